package tech.yump.configserver.http;

import tech.yump.configserver.exceptions.ConfigServerTransportException;

import java.util.Map;

/**
 * Transport used to reach the config server.
 * Implementations return every HTTP answer as a {@link ConfigServerResponse},
 * error statuses included, and only throw when no answer could be obtained.
 */
public interface ConfigServerHttpClient {

    /**
     * Fetches the value stored under an absolute name.
     *
     * @param name absolute config server name, e.g. {@code /director/deployment/db_password}.
     * @return the response, whatever its status.
     * @throws ConfigServerTransportException if the config server could not be reached.
     */
    ConfigServerResponse get(String name) throws ConfigServerTransportException;

    /**
     * Posts a JSON body for an absolute name, used to request value generation.
     *
     * @param name absolute config server name.
     * @param body request body, serialized as JSON.
     * @return the response, whatever its status.
     * @throws ConfigServerTransportException if the config server could not be reached.
     */
    ConfigServerResponse post(String name, Map<String, Object> body) throws ConfigServerTransportException;
}
