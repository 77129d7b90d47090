package tech.yump.configserver.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of looking a name up on the config server.
 */
public sealed interface FetchResult permits FetchResult.Found, FetchResult.NotFound, FetchResult.Error {

    /**
     * @param name  absolute name that was looked up.
     * @param value decoded value, any JSON shape.
     * @param id    identifier the config server assigned to this value.
     */
    record Found(String name, JsonNode value, String id) implements FetchResult {
    }

    record NotFound(String name) implements FetchResult {
    }

    record Error(String name, String detail) implements FetchResult {
    }
}
