package tech.yump.configserver.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;

/**
 * Records which config server values a deployment consumed.
 */
@RequiredArgsConstructor
public class PlaceholderMappingRecorder {

    private final PlaceholderMappingBackend backend;
    private final Clock clock;

    public PlaceholderMappingRecorder(PlaceholderMappingBackend backend) {
        this(backend, Clock.systemUTC());
    }

    /**
     * @param placeholderName absolute config server name.
     * @param placeholderId   id of the value returned by the config server.
     * @param deploymentName  deployment that consumed the value, null for runtime manifests.
     */
    public PlaceholderMapping record(String placeholderName, @Nullable String placeholderId, @Nullable String deploymentName) {
        PlaceholderMapping mapping = PlaceholderMapping.builder()
                .placeholderName(placeholderName)
                .placeholderId(placeholderId)
                .deploymentName(deploymentName)
                .createdAt(Instant.now(clock))
                .build();
        backend.save(mapping);
        return mapping;
    }
}
