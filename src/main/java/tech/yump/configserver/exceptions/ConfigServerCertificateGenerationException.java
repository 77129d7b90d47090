package tech.yump.configserver.exceptions;

public class ConfigServerCertificateGenerationException extends ConfigServerGenerationException {

    public ConfigServerCertificateGenerationException(String name) {
        super("certificate", name);
    }
}
