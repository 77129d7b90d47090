package tech.yump.configserver.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static tech.yump.configserver.JsonTestSupport.MAPPER;

@ExtendWith(OutputCaptureExtension.class)
class LogPlaceholderMappingBackendTest {

    @Test
    @DisplayName("Logs the mapping as a prefixed JSON line")
    void logsMapping(CapturedOutput output) {
        LogPlaceholderMappingBackend backend = new LogPlaceholderMappingBackend(MAPPER);

        backend.save(new PlaceholderMapping("/director/deployment/db_password", "42", "deployment",
                Instant.parse("2026-03-01T10:15:30Z")));

        assertThat(output.getOut())
                .contains("PLACEHOLDER_MAPPING:")
                .contains("\"placeholderName\":\"/director/deployment/db_password\"")
                .contains("\"placeholderId\":\"42\"")
                .contains("\"deploymentName\":\"deployment\"");
    }

    @Test
    @DisplayName("Omits the deployment name of runtime mappings")
    void omitsNullFields(CapturedOutput output) {
        LogPlaceholderMappingBackend backend = new LogPlaceholderMappingBackend(MAPPER);

        backend.save(new PlaceholderMapping("/global/ca", "7", null, Instant.parse("2026-03-01T10:15:30Z")));

        assertThat(output.getOut())
                .contains("\"placeholderName\":\"/global/ca\"")
                .doesNotContain("deploymentName");
    }

    @Test
    void rejectsNullMapping() {
        LogPlaceholderMappingBackend backend = new LogPlaceholderMappingBackend(MAPPER);

        assertThatThrownBy(() -> backend.save(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Wraps serialization failures")
    void wrapsSerializationFailure() throws JsonProcessingException {
        ObjectMapper failingMapper = mock(ObjectMapper.class);
        when(failingMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("cannot write") {
        });
        LogPlaceholderMappingBackend backend = new LogPlaceholderMappingBackend(failingMapper);

        assertThatThrownBy(() -> backend.save(new PlaceholderMapping("/a", "1", "d", Instant.now())))
                .isInstanceOf(PlaceholderMappingException.class)
                .hasMessage("Failed to serialize placeholder mapping for name: /a")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }
}
