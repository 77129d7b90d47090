package tech.yump.configserver.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties under the 'config-server' prefix.
 */
@ConfigurationProperties(prefix = "config-server")
@Validated
public record ConfigServerProperties(

        boolean enabled,

        String url,

        String directorName,

        String authToken,

        Duration connectTimeout,

        Duration readTimeout,

        @Valid
        PlaceholderMappingsProperties placeholderMappings
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    public ConfigServerProperties {
        if (connectTimeout == null) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
        if (readTimeout == null) {
            readTimeout = DEFAULT_READ_TIMEOUT;
        }
        if (placeholderMappings == null) {
            placeholderMappings = new PlaceholderMappingsProperties(null, null);
        }
    }

    @AssertTrue(message = "Config server URL (config-server.url) must be provided when the config server is enabled.")
    public boolean isUrlValid() {
        return !enabled || StringUtils.hasText(url);
    }

    @AssertTrue(message = "Director name (config-server.director-name) must be provided when the config server is enabled.")
    public boolean isDirectorNameValid() {
        return !enabled || StringUtils.hasText(directorName);
    }

    @Override
    public String toString() {
        // Keep the token out of logs
        return "ConfigServerProperties[" +
                "enabled=" + enabled +
                ", url='" + url + '\'' +
                ", directorName='" + directorName + '\'' +
                ", authToken=" + (authToken == null ? "null" : "******") +
                ", connectTimeout=" + connectTimeout +
                ", readTimeout=" + readTimeout +
                ", placeholderMappings=" + placeholderMappings +
                ']';
    }

    public enum MappingBackend {
        SLF4J, JDBC
    }

    // --- PlaceholderMappingsProperties ---
    @Validated
    public record PlaceholderMappingsProperties(
            MappingBackend backend,

            @Valid
            JdbcProperties jdbc
    ) {
        public PlaceholderMappingsProperties {
            if (backend == null) {
                backend = MappingBackend.SLF4J;
            }
        }

        @AssertTrue(message = "JDBC settings (config-server.placeholder-mappings.jdbc) are required when the jdbc backend is selected.")
        public boolean isJdbcConfigValid() {
            return backend != MappingBackend.JDBC || jdbc != null;
        }
    }

    // --- JdbcProperties ---
    @Validated
    public record JdbcProperties(
            @NotNull(message = "JDBC connection URL (config-server.placeholder-mappings.jdbc.connection-url) must be provided.")
            String connectionUrl,

            String username,

            String password,

            boolean initializeSchema
    ) {
        @Override
        public String toString() {
            return "JdbcProperties[" +
                    "connectionUrl='" + connectionUrl + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", initializeSchema=" + initializeSchema +
                    ']';
        }
    }
}
