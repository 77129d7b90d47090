package tech.yump.configserver.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Records that a deployment consumed a config server value.
 * Created once per distinct placeholder name resolved during an interpolation, never updated.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaceholderMapping(
        String placeholderName, // Absolute config server name
        String placeholderId,   // Id the config server assigned to the value that was used
        String deploymentName,  // Null for director-wide (runtime) manifests
        Instant createdAt
) {
}
