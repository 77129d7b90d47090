package tech.yump.configserver.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.http.HttpMessageConvertersAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.client.RestTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.configserver.client.ConfigServerClient;
import tech.yump.configserver.client.DisabledConfigServerClient;
import tech.yump.configserver.client.EnabledConfigServerClient;
import tech.yump.configserver.gateway.ConfigServerGateway;
import tech.yump.configserver.http.ConfigServerHttpClient;
import tech.yump.configserver.http.RestTemplateConfigServerHttpClient;
import tech.yump.configserver.interpolation.ManifestInterpolator;
import tech.yump.configserver.interpolation.PlaceholderNameResolver;
import tech.yump.configserver.mapping.LogPlaceholderMappingBackend;
import tech.yump.configserver.mapping.PlaceholderMappingBackend;
import tech.yump.configserver.mapping.PlaceholderMappingRecorder;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigServerClientConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    JacksonAutoConfiguration.class,
                    HttpMessageConvertersAutoConfiguration.class,
                    RestTemplateAutoConfiguration.class))
            .withUserConfiguration(TestConfig.class, ConfigServerClientConfiguration.class,
                    PlaceholderMappingConfiguration.class);

    @EnableConfigurationProperties(ConfigServerProperties.class)
    static class TestConfig {}

    @Test
    @DisplayName("Uses the disabled client when the config server is not enabled")
    void disabledByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(ConfigServerClient.class);
            assertThat(context.getBean(ConfigServerClient.class)).isInstanceOf(DisabledConfigServerClient.class);
            assertThat(context).doesNotHaveBean(ConfigServerHttpClient.class);
            assertThat(context).doesNotHaveBean(ManifestInterpolator.class);
        });
    }

    @Test
    @DisplayName("Uses the enabled client wired to the configured server")
    void enabled() {
        contextRunner
                .withPropertyValues(
                        "config-server.enabled=true",
                        "config-server.url=https://config-server.example:8080",
                        "config-server.director-name=smurf_director_name",
                        "config-server.auth-token=token"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(ConfigServerClient.class);
                    assertThat(context.getBean(ConfigServerClient.class)).isInstanceOf(EnabledConfigServerClient.class);
                    assertThat(context.getBean(ConfigServerHttpClient.class)).isInstanceOf(RestTemplateConfigServerHttpClient.class);
                    assertThat(context).hasSingleBean(ConfigServerGateway.class);
                    assertThat(context.getBean(PlaceholderNameResolver.class).getDirectorName()).isEqualTo("smurf_director_name");
                });
    }

    @Test
    @DisplayName("Records placeholder mappings through the log backend by default")
    void logMappingBackendByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(PlaceholderMappingRecorder.class);
            assertThat(context.getBean(PlaceholderMappingBackend.class)).isInstanceOf(LogPlaceholderMappingBackend.class);
        });
    }

    @Test
    @DisplayName("Fails to start when enabled without a URL")
    void enabledWithoutUrl() {
        contextRunner
                .withPropertyValues(
                        "config-server.enabled=true",
                        "config-server.director-name=smurf_director_name"
                )
                .run(context -> assertThat(context).hasFailed());
    }
}
