package tech.yump.configserver.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;
import tech.yump.configserver.interpolation.GenerationOptions;
import tech.yump.configserver.interpolation.InterpolationOptions;

/**
 * Entry point for resolving config server placeholders.
 * One implementation is selected at startup: {@link EnabledConfigServerClient} when a config server
 * is configured, {@link DisabledConfigServerClient} otherwise.
 */
public interface ConfigServerClient {

    /**
     * Returns a copy of the manifest with every placeholder outside the ignored subtrees replaced.
     *
     * @param manifest       the manifest to interpolate; left untouched.
     * @param deploymentName deployment used to namespace relative names, may be null when names must be absolute.
     * @param options        ignored subtrees and absolute name policy.
     * @throws tech.yump.configserver.exceptions.ConfigServerIncorrectNameSyntaxException on an invalid name.
     * @throws tech.yump.configserver.exceptions.ConfigServerMissingNamesException if any name is not on the config server.
     * @throws tech.yump.configserver.exceptions.ConfigServerUnknownErrorException if the config server answers with an error.
     */
    JsonNode interpolate(JsonNode manifest, @Nullable String deploymentName, InterpolationOptions options);

    default JsonNode interpolate(JsonNode manifest, @Nullable String deploymentName) {
        return interpolate(manifest, deploymentName, InterpolationOptions.defaults());
    }

    /**
     * Interpolates a deployment manifest, namespacing relative names under the manifest's own name.
     * Job properties, env sections and the top level {@code name} are left alone.
     */
    JsonNode interpolateDeploymentManifest(JsonNode manifest);

    /**
     * Interpolates a director wide runtime manifest. Every placeholder name must be absolute.
     * Addon job properties are left alone.
     */
    JsonNode interpolateRuntimeManifest(JsonNode manifest);

    /**
     * Resolves a single property that may be a placeholder.
     *
     * @param propertyValue  the value given in the manifest, null when absent.
     * @param defaultValue   the default declared by the job.
     * @param type           the property type declared by the job, e.g. {@code password} or {@code certificate}.
     * @param deploymentName deployment used to namespace the name.
     * @param options        generation input, e.g. DNS names for certificates.
     * @return the default when no value was given, otherwise the given value unchanged.
     */
    JsonNode prepareAndGetProperty(@Nullable JsonNode propertyValue,
                                   @Nullable JsonNode defaultValue,
                                   @Nullable String type,
                                   @Nullable String deploymentName,
                                   GenerationOptions options);

    default JsonNode prepareAndGetProperty(@Nullable JsonNode propertyValue,
                                           @Nullable JsonNode defaultValue,
                                           @Nullable String type,
                                           @Nullable String deploymentName) {
        return prepareAndGetProperty(propertyValue, defaultValue, type, deploymentName, GenerationOptions.none());
    }
}
