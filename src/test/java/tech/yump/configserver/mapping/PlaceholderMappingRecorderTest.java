package tech.yump.configserver.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PlaceholderMappingRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Mock
    private PlaceholderMappingBackend backend;

    private PlaceholderMappingRecorder recorder() {
        return new PlaceholderMappingRecorder(backend, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Stores one mapping with the clock's time")
    void recordsMapping() {
        PlaceholderMapping mapping = recorder().record("/director/deployment/db_password", "42", "deployment");

        assertThat(mapping).isEqualTo(new PlaceholderMapping("/director/deployment/db_password", "42", "deployment", NOW));
        verify(backend).save(mapping);
    }

    @Test
    @DisplayName("Accepts a missing deployment name for runtime manifests")
    void recordsRuntimeMapping() {
        PlaceholderMapping mapping = recorder().record("/global/ca", "7", null);

        assertThat(mapping.deploymentName()).isNull();
        verify(backend).save(mapping);
    }

    @Test
    @DisplayName("Propagates backend failures")
    void propagatesFailure() {
        doThrow(new PlaceholderMappingException("boom")).when(backend).save(any());

        assertThatThrownBy(() -> recorder().record("/a", "1", "d"))
                .isInstanceOf(PlaceholderMappingException.class)
                .hasMessage("boom");
    }
}
