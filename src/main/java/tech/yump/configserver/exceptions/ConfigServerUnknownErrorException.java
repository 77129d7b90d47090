package tech.yump.configserver.exceptions;

/**
 * Thrown when the config server answers with anything other than success or not-found.
 */
public class ConfigServerUnknownErrorException extends ConfigServerException {

    public ConfigServerUnknownErrorException(String message) {
        super(message);
    }
}
