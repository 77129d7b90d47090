package tech.yump.configserver.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.configserver.interpolation.GenerationOptions;
import tech.yump.configserver.interpolation.IgnoredSubtreePath;
import tech.yump.configserver.interpolation.InterpolationOptions;
import tech.yump.configserver.interpolation.ManifestInterpolator;
import tech.yump.configserver.interpolation.PropertyPreparer;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static tech.yump.configserver.JsonTestSupport.json;
import static tech.yump.configserver.JsonTestSupport.text;

@ExtendWith(MockitoExtension.class)
class EnabledConfigServerClientTest {

    @Mock
    private ManifestInterpolator interpolator;

    @Mock
    private PropertyPreparer propertyPreparer;

    @InjectMocks
    private EnabledConfigServerClient client;

    @Test
    @DisplayName("Deployment manifests are namespaced under their name with job sections ignored")
    void interpolateDeploymentManifest() {
        JsonNode manifest = json("{'name': 'my-deployment', 'releases': [{'name': '((release))'}]}");
        JsonNode interpolated = json("{'name': 'my-deployment', 'releases': [{'name': 'bosh'}]}");
        when(interpolator.interpolate(eq(manifest), eq("my-deployment"), any())).thenReturn(interpolated);

        assertThat(client.interpolateDeploymentManifest(manifest)).isSameAs(interpolated);

        ArgumentCaptor<InterpolationOptions> options = ArgumentCaptor.forClass(InterpolationOptions.class);
        verify(interpolator).interpolate(eq(manifest), eq("my-deployment"), options.capture());
        assertThat(options.getValue().mustBeAbsoluteName()).isFalse();
        assertThat(options.getValue().subtreesToIgnore())
                .containsAll(ManifestSubtrees.DEPLOYMENT_MANIFEST)
                .contains(IgnoredSubtreePath.keys("name"))
                .hasSize(ManifestSubtrees.DEPLOYMENT_MANIFEST.size() + 1);
    }

    @Test
    @DisplayName("A deployment manifest without a textual name has no deployment name")
    void interpolateDeploymentManifest_withoutName() {
        JsonNode manifest = json("{'name': 12}");
        when(interpolator.interpolate(eq(manifest), isNull(), any())).thenReturn(manifest);

        assertThat(client.interpolateDeploymentManifest(manifest)).isSameAs(manifest);
    }

    @Test
    @DisplayName("Runtime manifests require absolute names and skip addon properties")
    void interpolateRuntimeManifest() {
        JsonNode manifest = json("{'addons': [{'properties': {'a': '((b))'}}]}");
        when(interpolator.interpolate(eq(manifest), isNull(), any())).thenReturn(manifest);

        client.interpolateRuntimeManifest(manifest);

        ArgumentCaptor<InterpolationOptions> options = ArgumentCaptor.forClass(InterpolationOptions.class);
        verify(interpolator).interpolate(eq(manifest), isNull(), options.capture());
        assertThat(options.getValue().mustBeAbsoluteName()).isTrue();
        assertThat(options.getValue().subtreesToIgnore()).isEqualTo(ManifestSubtrees.RUNTIME_MANIFEST);
    }

    @Test
    @DisplayName("The two argument interpolate uses default options")
    void interpolate_defaults() {
        JsonNode manifest = json("{'a': '((b))'}");
        when(interpolator.interpolate(manifest, "deployment", InterpolationOptions.defaults())).thenReturn(manifest);

        assertThat(client.interpolate(manifest, "deployment")).isSameAs(manifest);
    }

    @Test
    @DisplayName("Property preparation is delegated, without generation options by default")
    void prepareAndGetProperty() {
        when(propertyPreparer.prepareAndGetProperty(text("((p))"), null, "password", "deployment", GenerationOptions.none()))
                .thenReturn(text("((p))"));
        GenerationOptions dns = new GenerationOptions(List.of("a.bosh"));
        when(propertyPreparer.prepareAndGetProperty(text("((c))"), null, "certificate", "deployment", dns))
                .thenReturn(text("((c))"));

        assertThat(client.prepareAndGetProperty(text("((p))"), null, "password", "deployment")).isEqualTo(text("((p))"));
        assertThat(client.prepareAndGetProperty(text("((c))"), null, "certificate", "deployment", dns)).isEqualTo(text("((c))"));
    }
}
