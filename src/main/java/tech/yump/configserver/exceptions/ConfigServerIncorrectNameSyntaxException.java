package tech.yump.configserver.exceptions;

/**
 * Thrown when a placeholder name does not follow the name grammar, or when an
 * absolute name is required and the placeholder name is relative.
 */
public class ConfigServerIncorrectNameSyntaxException extends ConfigServerException {

    public ConfigServerIncorrectNameSyntaxException(String message) {
        super(message);
    }
}
