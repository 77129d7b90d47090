package tech.yump.configserver.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.configserver.interpolation.GenerationOptions;
import tech.yump.configserver.interpolation.InterpolationOptions;
import tech.yump.configserver.interpolation.ManifestInterpolator;
import tech.yump.configserver.interpolation.PropertyPreparer;

/**
 * Client used when a config server is configured.
 */
@Slf4j
@RequiredArgsConstructor
public class EnabledConfigServerClient implements ConfigServerClient {

    private static final String NAME_FIELD = "name";

    private final ManifestInterpolator interpolator;
    private final PropertyPreparer propertyPreparer;

    @Override
    public JsonNode interpolate(JsonNode manifest, @Nullable String deploymentName, InterpolationOptions options) {
        return interpolator.interpolate(manifest, deploymentName, options);
    }

    @Override
    public JsonNode interpolateDeploymentManifest(JsonNode manifest) {
        JsonNode name = manifest.get(NAME_FIELD);
        String deploymentName = name != null && name.isTextual() ? name.textValue() : null;
        log.debug("Interpolating deployment manifest '{}'", deploymentName);
        return interpolate(manifest, deploymentName,
                new InterpolationOptions(ManifestSubtrees.forDeploymentManifest(), false));
    }

    @Override
    public JsonNode interpolateRuntimeManifest(JsonNode manifest) {
        log.debug("Interpolating runtime manifest");
        return interpolate(manifest, null, new InterpolationOptions(ManifestSubtrees.RUNTIME_MANIFEST, true));
    }

    @Override
    public JsonNode prepareAndGetProperty(@Nullable JsonNode propertyValue,
                                          @Nullable JsonNode defaultValue,
                                          @Nullable String type,
                                          @Nullable String deploymentName,
                                          GenerationOptions options) {
        return propertyPreparer.prepareAndGetProperty(propertyValue, defaultValue, type, deploymentName, options);
    }
}
