package tech.yump.configserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import tech.yump.configserver.mapping.JdbcPlaceholderMappingBackend;
import tech.yump.configserver.mapping.LogPlaceholderMappingBackend;
import tech.yump.configserver.mapping.PlaceholderMappingBackend;
import tech.yump.configserver.mapping.PlaceholderMappingRecorder;

import javax.sql.DataSource;

@Configuration
@Slf4j
public class PlaceholderMappingConfiguration {

    static final String BACKEND_PROPERTY = "config-server.placeholder-mappings.backend";

    @Bean
    public PlaceholderMappingRecorder placeholderMappingRecorder(PlaceholderMappingBackend placeholderMappingBackend) {
        return new PlaceholderMappingRecorder(placeholderMappingBackend);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "slf4j", matchIfMissing = true)
    public PlaceholderMappingBackend logPlaceholderMappingBackend(ObjectMapper objectMapper) {
        log.info("Configuring SLF4J placeholder mapping backend");
        return new LogPlaceholderMappingBackend(objectMapper);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "jdbc")
    static class JdbcBackendConfiguration {

        @Bean(destroyMethod = "close")
        public HikariDataSource placeholderMappingDataSource(ConfigServerProperties properties) {
            ConfigServerProperties.JdbcProperties jdbc = properties.placeholderMappings().jdbc();
            if (jdbc == null) {
                throw new IllegalStateException("Missing JDBC configuration for placeholder mappings.");
            }

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(jdbc.connectionUrl());
            config.setUsername(jdbc.username());
            config.setPassword(jdbc.password());
            config.setPoolName("PlaceholderMappingPool");
            config.setMaximumPoolSize(5);
            config.setMinimumIdle(1);

            log.info("Creating HikariDataSource for placeholder mappings, URL: {}, User: {}", config.getJdbcUrl(), config.getUsername());
            return new HikariDataSource(config);
        }

        @Bean
        public PlaceholderMappingBackend jdbcPlaceholderMappingBackend(DataSource placeholderMappingDataSource,
                                                                       ConfigServerProperties properties) {
            log.info("Configuring JDBC placeholder mapping backend");
            JdbcPlaceholderMappingBackend backend = new JdbcPlaceholderMappingBackend(new JdbcTemplate(placeholderMappingDataSource));
            if (properties.placeholderMappings().jdbc().initializeSchema()) {
                backend.initializeSchema();
            }
            return backend;
        }
    }
}
