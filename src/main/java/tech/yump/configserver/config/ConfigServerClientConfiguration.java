package tech.yump.configserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import tech.yump.configserver.client.ConfigServerClient;
import tech.yump.configserver.client.DisabledConfigServerClient;
import tech.yump.configserver.client.EnabledConfigServerClient;
import tech.yump.configserver.gateway.ConfigServerGateway;
import tech.yump.configserver.http.ConfigServerHttpClient;
import tech.yump.configserver.http.RestTemplateConfigServerHttpClient;
import tech.yump.configserver.interpolation.ManifestInterpolator;
import tech.yump.configserver.interpolation.PlaceholderNameResolver;
import tech.yump.configserver.interpolation.PropertyPreparer;
import tech.yump.configserver.mapping.PlaceholderMappingRecorder;

/**
 * Chooses the {@link ConfigServerClient} implementation once, from {@code config-server.enabled}.
 */
@Configuration
@Slf4j
public class ConfigServerClientConfiguration {

    static final String ENABLED_PROPERTY = "config-server.enabled";

    @Bean
    @ConditionalOnProperty(name = ENABLED_PROPERTY, havingValue = "false", matchIfMissing = true)
    public ConfigServerClient disabledConfigServerClient() {
        log.info("Config server is disabled, placeholders will not be interpolated");
        return new DisabledConfigServerClient();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = ENABLED_PROPERTY, havingValue = "true")
    static class EnabledClientConfiguration {

        @Bean
        public ConfigServerHttpClient configServerHttpClient(RestTemplateBuilder restTemplateBuilder,
                                                             ConfigServerProperties properties) {
            RestTemplateBuilder builder = restTemplateBuilder
                    .rootUri(properties.url())
                    .connectTimeout(properties.connectTimeout())
                    .readTimeout(properties.readTimeout());
            if (StringUtils.hasText(properties.authToken())) {
                builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.authToken());
            }
            log.info("Configuring config server client for URL: {}", properties.url());
            return new RestTemplateConfigServerHttpClient(builder.build());
        }

        @Bean
        public ConfigServerGateway configServerGateway(ConfigServerHttpClient configServerHttpClient, ObjectMapper objectMapper) {
            return new ConfigServerGateway(configServerHttpClient, objectMapper);
        }

        @Bean
        public PlaceholderNameResolver placeholderNameResolver(ConfigServerProperties properties) {
            return new PlaceholderNameResolver(properties.directorName());
        }

        @Bean
        public ManifestInterpolator manifestInterpolator(PlaceholderNameResolver placeholderNameResolver,
                                                         ConfigServerGateway configServerGateway,
                                                         PlaceholderMappingRecorder placeholderMappingRecorder) {
            return new ManifestInterpolator(placeholderNameResolver, configServerGateway, placeholderMappingRecorder);
        }

        @Bean
        public PropertyPreparer propertyPreparer(PlaceholderNameResolver placeholderNameResolver,
                                                 ConfigServerGateway configServerGateway) {
            return new PropertyPreparer(placeholderNameResolver, configServerGateway);
        }

        @Bean
        public ConfigServerClient enabledConfigServerClient(ManifestInterpolator manifestInterpolator,
                                                            PropertyPreparer propertyPreparer) {
            log.info("Config server is enabled");
            return new EnabledConfigServerClient(manifestInterpolator, propertyPreparer);
        }
    }
}
