package tech.yump.configserver.exceptions;

import java.util.List;

/**
 * Thrown when one or more placeholder names could not be found on the config server.
 * Carries every missing name found during the lookup batch, not only the first.
 */
public class ConfigServerMissingNamesException extends ConfigServerException {

    private final List<String> missingNames;

    public ConfigServerMissingNamesException(List<String> missingNames) {
        super("Failed to load placeholder names from the config server: " + String.join(", ", missingNames));
        this.missingNames = List.copyOf(missingNames);
    }

    public List<String> getMissingNames() {
        return missingNames;
    }
}
