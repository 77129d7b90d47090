package tech.yump.configserver.mapping;

/**
 * Raised when a placeholder mapping could not be persisted.
 */
public class PlaceholderMappingException extends RuntimeException {

    public PlaceholderMappingException(String message) {
        super(message);
    }

    public PlaceholderMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
