package tech.yump.configserver.mapping;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;

/**
 * Stores placeholder mappings in the {@value #TABLE_NAME} table.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcPlaceholderMappingBackend implements PlaceholderMappingBackend {

    static final String TABLE_NAME = "placeholder_mappings";

    static final String CREATE_TABLE_SQL = "CREATE TABLE IF NOT EXISTS " + TABLE_NAME + " ("
            + "id BIGSERIAL PRIMARY KEY, "
            + "placeholder_name VARCHAR(1024) NOT NULL, "
            + "placeholder_id VARCHAR(255), "
            + "deployment_name VARCHAR(255), "
            + "created_at TIMESTAMP NOT NULL)";

    static final String INSERT_SQL = "INSERT INTO " + TABLE_NAME
            + " (placeholder_name, placeholder_id, deployment_name, created_at) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public void initializeSchema() {
        log.info("Ensuring table '{}' exists", TABLE_NAME);
        try {
            jdbcTemplate.execute(CREATE_TABLE_SQL);
        } catch (DataAccessException e) {
            log.error("Failed to create table '{}': {}", TABLE_NAME, e.getMessage(), e);
            throw new PlaceholderMappingException("Failed to initialize table: " + TABLE_NAME, e);
        }
    }

    @Override
    public void save(PlaceholderMapping mapping) {
        if (mapping == null) {
            throw new IllegalArgumentException("Placeholder mapping cannot be null.");
        }

        try {
            jdbcTemplate.update(INSERT_SQL,
                    mapping.placeholderName(),
                    mapping.placeholderId(),
                    mapping.deploymentName(),
                    Timestamp.from(mapping.createdAt()));
            log.debug("Stored placeholder mapping for name '{}' (id: {})", mapping.placeholderName(), mapping.placeholderId());
        } catch (DataAccessException e) {
            log.error("Failed to store placeholder mapping for name '{}': {}", mapping.placeholderName(), e.getMessage(), e);
            throw new PlaceholderMappingException(
                    "Failed to store placeholder mapping for name: " + mapping.placeholderName(), e);
        }
    }
}
