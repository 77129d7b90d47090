package tech.yump.configserver.exceptions;

/**
 * Base exception for every failure raised while talking to the config server
 * or interpolating placeholders against it.
 */
public class ConfigServerException extends RuntimeException {

    public ConfigServerException(String message) {
        super(message);
    }

    public ConfigServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
