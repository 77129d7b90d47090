package tech.yump.configserver.interpolation;

import java.util.List;

/**
 * @param subtreesToIgnore    manifest subtrees copied verbatim, without looking for placeholders.
 * @param mustBeAbsoluteName  whether relative placeholder names are rejected instead of namespaced.
 */
public record InterpolationOptions(List<IgnoredSubtreePath> subtreesToIgnore, boolean mustBeAbsoluteName) {

    public InterpolationOptions {
        subtreesToIgnore = subtreesToIgnore == null ? List.of() : List.copyOf(subtreesToIgnore);
    }

    public static InterpolationOptions defaults() {
        return new InterpolationOptions(List.of(), false);
    }
}
