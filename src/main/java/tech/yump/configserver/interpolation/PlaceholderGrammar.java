package tech.yump.configserver.interpolation;

import com.fasterxml.jackson.databind.JsonNode;
import tech.yump.configserver.exceptions.ConfigServerIncorrectNameSyntaxException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes placeholder tokens and validates their names.
 * <p>
 * A scalar is a placeholder only when the whole string is wrapped in {@code ((} and {@code ))}.
 * The inner text may start with the do-not-track marker {@code !}; what remains must be a
 * name made of {@code [A-Za-z0-9_.-]} segments separated by {@code /}, optionally absolute.
 */
public final class PlaceholderGrammar {

    public static final String DO_NOT_TRACK_MARKER = "!";

    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\A\\(\\((.*)\\)\\)\\z", Pattern.DOTALL);
    private static final Pattern NAME_PATTERN = Pattern.compile("\\A/?[A-Za-z0-9_.\\-]+(/[A-Za-z0-9_.\\-]+)*\\z");

    private PlaceholderGrammar() {
    }

    /**
     * Extracts the placeholder held by a scalar.
     *
     * @param value the scalar text, may be null.
     * @return the placeholder, or empty if the value is not wrapped in {@code ((...))}.
     * @throws ConfigServerIncorrectNameSyntaxException if the value is wrapped but its name is invalid.
     */
    public static Optional<Placeholder> extract(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = TOKEN_PATTERN.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String inner = matcher.group(1);
        boolean doNotTrack = inner.startsWith(DO_NOT_TRACK_MARKER);
        String name = doNotTrack ? inner.substring(DO_NOT_TRACK_MARKER.length()) : inner;
        validateName(name);
        return Optional.of(new Placeholder(value, name, doNotTrack));
    }

    public static Optional<Placeholder> extract(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return extract(node.textValue());
    }

    static void validateName(String name) {
        if (name.isEmpty() || !NAME_PATTERN.matcher(name).matches()) {
            throw new ConfigServerIncorrectNameSyntaxException(String.format(
                    "Placeholder name '%s' must only contain alphanumeric characters, underscores, dashes, dots or forward slashes",
                    name));
        }
    }
}
