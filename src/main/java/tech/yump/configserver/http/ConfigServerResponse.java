package tech.yump.configserver.http;

import org.springframework.lang.Nullable;

/**
 * Status code and raw body of a config server response.
 */
public record ConfigServerResponse(int statusCode, @Nullable String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
