package tech.yump.configserver.interpolation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.configserver.exceptions.ConfigServerCertificateGenerationException;
import tech.yump.configserver.exceptions.ConfigServerGenerationException;
import tech.yump.configserver.exceptions.ConfigServerPasswordGenerationException;
import tech.yump.configserver.exceptions.ConfigServerUnknownErrorException;
import tech.yump.configserver.gateway.ConfigServerGateway;
import tech.yump.configserver.gateway.FetchResult;
import tech.yump.configserver.gateway.GeneratableType;
import tech.yump.configserver.gateway.GenerationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prepares a single job property that may be a placeholder.
 * <p>
 * The placeholder is never replaced by its value here: when the name exists on the config server,
 * or has just been generated there, the original token is returned so that it is interpolated later.
 */
@Slf4j
@RequiredArgsConstructor
public class PropertyPreparer {

    static final String COMMON_NAME = "common_name";
    static final String ALTERNATIVE_NAMES = "alternative_names";

    private final PlaceholderNameResolver nameResolver;
    private final ConfigServerGateway gateway;

    public JsonNode prepareAndGetProperty(@Nullable JsonNode propertyValue,
                                          @Nullable JsonNode defaultValue,
                                          @Nullable String type,
                                          @Nullable String deploymentName,
                                          GenerationOptions options) {
        if (isAbsent(propertyValue)) {
            return defaultValue;
        }

        Optional<Placeholder> extracted = PlaceholderGrammar.extract(propertyValue);
        if (extracted.isEmpty()) {
            return propertyValue;
        }

        Placeholder placeholder = extracted.get();
        JsonNode token = TextNode.valueOf(placeholder.token());
        String name = nameResolver.resolve(placeholder.name(), deploymentName, false);
        FetchResult result = gateway.fetch(name);

        if (result instanceof FetchResult.Found) {
            return token;
        }
        if (result instanceof FetchResult.Error error) {
            log.error("Config server returned an error while checking name '{}': {}", name, error.detail());
            throw new ConfigServerUnknownErrorException(String.format(
                    "Failed to check placeholder '%s' on the config server: %s", name, error.detail()));
        }

        if (!isAbsent(defaultValue)) {
            return defaultValue;
        }

        Optional<GeneratableType> generatableType = GeneratableType.fromTypeName(type);
        if (generatableType.isEmpty()) {
            log.debug("Name '{}' not found and type '{}' cannot be generated, keeping placeholder {}",
                    name, type, placeholder.token());
            return token;
        }

        generate(name, generatableType.get(), options);
        return token;
    }

    private void generate(String name, GeneratableType type, GenerationOptions options) {
        Map<String, Object> parameters = switch (type) {
            case PASSWORD -> null;
            case CERTIFICATE -> certificateParameters(name, options);
        };

        GenerationResult result = gateway.generate(name, type.typeName(), parameters);
        if (result instanceof GenerationResult.Error error) {
            ConfigServerGenerationException exception = switch (type) {
                case PASSWORD -> new ConfigServerPasswordGenerationException(name);
                case CERTIFICATE -> new ConfigServerCertificateGenerationException(name);
            };
            log.error("{} ({})", exception.getMessage(), error.detail());
            throw exception;
        }
        log.info("Config server generated {} for name '{}'", type.typeName(), name);
    }

    private Map<String, Object> certificateParameters(String name, GenerationOptions options) {
        List<String> dnsRecordNames = options == null ? List.of() : options.dnsRecordNames();
        if (dnsRecordNames.isEmpty()) {
            throw new IllegalArgumentException("DNS record names are required to generate a certificate for: " + name);
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(COMMON_NAME, dnsRecordNames.get(0));
        parameters.put(ALTERNATIVE_NAMES, dnsRecordNames);
        return parameters;
    }

    private static boolean isAbsent(@Nullable JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }
}
