package tech.yump.configserver.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;
import tech.yump.configserver.interpolation.GenerationOptions;
import tech.yump.configserver.interpolation.InterpolationOptions;

/**
 * Client used when no config server is configured. Manifests and properties pass through unchanged;
 * the config server is never contacted.
 */
public class DisabledConfigServerClient implements ConfigServerClient {

    @Override
    public JsonNode interpolate(JsonNode manifest, @Nullable String deploymentName, InterpolationOptions options) {
        return manifest;
    }

    @Override
    public JsonNode interpolateDeploymentManifest(JsonNode manifest) {
        return manifest;
    }

    @Override
    public JsonNode interpolateRuntimeManifest(JsonNode manifest) {
        return manifest;
    }

    @Override
    public JsonNode prepareAndGetProperty(@Nullable JsonNode propertyValue,
                                          @Nullable JsonNode defaultValue,
                                          @Nullable String type,
                                          @Nullable String deploymentName,
                                          GenerationOptions options) {
        return propertyValue == null || propertyValue.isNull() || propertyValue.isMissingNode() ? defaultValue : propertyValue;
    }
}
