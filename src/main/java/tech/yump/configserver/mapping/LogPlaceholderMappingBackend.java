package tech.yump.configserver.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each placeholder mapping as a JSON line to the SLF4J logger at INFO level.
 */
@Slf4j
@RequiredArgsConstructor
public class LogPlaceholderMappingBackend implements PlaceholderMappingBackend {

    static final String LOG_PREFIX = "PLACEHOLDER_MAPPING:";

    private final ObjectMapper objectMapper;

    @Override
    public void save(PlaceholderMapping mapping) {
        if (mapping == null) {
            throw new IllegalArgumentException("Placeholder mapping cannot be null.");
        }

        try {
            log.info("{} {}", LOG_PREFIX, objectMapper.writeValueAsString(mapping));
        } catch (JsonProcessingException e) {
            throw new PlaceholderMappingException(
                    "Failed to serialize placeholder mapping for name: " + mapping.placeholderName(), e);
        }
    }
}
