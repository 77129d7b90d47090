package tech.yump.configserver.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import tech.yump.configserver.exceptions.ConfigServerTransportException;
import tech.yump.configserver.http.ConfigServerHttpClient;
import tech.yump.configserver.http.ConfigServerResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single round-trip operations against the config server, with every answer mapped to a typed outcome.
 * No retries are attempted here.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfigServerGateway {

    static final String VALUE_FIELD = "value";
    static final String ID_FIELD = "id";
    static final String TYPE_FIELD = "type";
    static final String PARAMETERS_FIELD = "parameters";

    private final ConfigServerHttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * Looks up an absolute name. A stored body has the shape {@code {"name": ..., "value": ..., "id": ...}}.
     */
    public FetchResult fetch(String name) {
        ConfigServerResponse response;
        try {
            response = httpClient.get(name);
        } catch (ConfigServerTransportException e) {
            return new FetchResult.Error(name, e.getMessage());
        }

        if (response.isNotFound()) {
            log.debug("Name '{}' not found on config server", name);
            return new FetchResult.NotFound(name);
        }
        if (!response.isSuccess()) {
            return new FetchResult.Error(name, "status " + response.statusCode());
        }
        if (!StringUtils.hasText(response.body())) {
            return new FetchResult.Error(name, "empty response body");
        }

        try {
            JsonNode body = objectMapper.readTree(response.body());
            if (body == null || !body.isObject() || !body.has(VALUE_FIELD)) {
                return new FetchResult.Error(name, "response body has no '" + VALUE_FIELD + "' field");
            }
            JsonNode id = body.get(ID_FIELD);
            String idText = (id == null || id.isNull()) ? null : id.asText();
            log.debug("Fetched name '{}' from config server (id: {})", name, idText);
            return new FetchResult.Found(name, body.get(VALUE_FIELD), idText);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse config server response for name '{}': {}", name, e.getOriginalMessage());
            return new FetchResult.Error(name, "unparseable response body");
        }
    }

    /**
     * Asks the config server to generate a value of the given type under an absolute name.
     *
     * @param parameters type specific parameters, omitted from the request when null.
     */
    public GenerationResult generate(String name, String type, @Nullable Map<String, Object> parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(TYPE_FIELD, type);
        if (parameters != null) {
            body.put(PARAMETERS_FIELD, parameters);
        }

        ConfigServerResponse response;
        try {
            response = httpClient.post(name, body);
        } catch (ConfigServerTransportException e) {
            return new GenerationResult.Error(name, e.getMessage());
        }

        if (!response.isSuccess()) {
            return new GenerationResult.Error(name, "status " + response.statusCode());
        }
        log.debug("Config server generated {} for name '{}'", type, name);
        return new GenerationResult.Success(name);
    }
}
