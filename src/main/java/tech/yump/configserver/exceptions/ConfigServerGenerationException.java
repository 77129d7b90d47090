package tech.yump.configserver.exceptions;

/**
 * Base exception for failed generation requests.
 */
public abstract class ConfigServerGenerationException extends ConfigServerException {

    private final String name;

    protected ConfigServerGenerationException(String kind, String name) {
        super(String.format("Config Server failed to generate %s for '%s'", kind, name));
        this.name = name;
    }

    /**
     * @return the absolute config server name the generation was requested for.
     */
    public String getName() {
        return name;
    }
}
