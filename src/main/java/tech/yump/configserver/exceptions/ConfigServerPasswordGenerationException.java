package tech.yump.configserver.exceptions;

public class ConfigServerPasswordGenerationException extends ConfigServerGenerationException {

    public ConfigServerPasswordGenerationException(String name) {
        super("password", name);
    }
}
