package tech.yump.configserver.exceptions;

/**
 * Thrown by the transport when the config server could not be reached at all
 * (connection refused, timeout, unreadable response).
 */
public class ConfigServerTransportException extends ConfigServerException {

    public ConfigServerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
