package tech.yump.configserver.interpolation;

import lombok.Getter;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import tech.yump.configserver.exceptions.ConfigServerIncorrectNameSyntaxException;

/**
 * Turns a placeholder name into the absolute name used on the config server.
 * Relative names are namespaced under {@code /<director>/<deployment>/}.
 */
public class PlaceholderNameResolver {

    private static final String SEPARATOR = "/";

    @Getter
    private final String directorName;

    public PlaceholderNameResolver(String directorName) {
        if (!StringUtils.hasText(directorName)) {
            throw new IllegalArgumentException("Director name cannot be null or empty.");
        }
        this.directorName = directorName;
    }

    public String resolve(String name, @Nullable String deploymentName, boolean mustBeAbsolute) {
        if (name.startsWith(SEPARATOR)) {
            return name;
        }
        if (mustBeAbsolute) {
            throw new ConfigServerIncorrectNameSyntaxException(String.format(
                    "Placeholder name '%s' must be absolute (start with '/')", name));
        }
        if (!StringUtils.hasText(deploymentName)) {
            throw new ConfigServerIncorrectNameSyntaxException(String.format(
                    "Placeholder name '%s' is relative but no deployment name is available to namespace it", name));
        }
        return SEPARATOR + directorName + SEPARATOR + deploymentName + SEPARATOR + name;
    }
}
