package tech.yump.configserver.interpolation;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A path pattern naming a manifest subtree that must never be interpolated.
 * A manifest path is covered when the pattern is a prefix of it, segment by segment.
 */
public record IgnoredSubtreePath(List<SegmentMatcher> matchers) {

    public IgnoredSubtreePath {
        if (matchers == null || matchers.isEmpty()) {
            throw new IllegalArgumentException("Ignored subtree path needs at least one segment matcher.");
        }
        matchers = List.copyOf(matchers);
    }

    public static IgnoredSubtreePath of(SegmentMatcher... matchers) {
        return new IgnoredSubtreePath(List.of(matchers));
    }

    /**
     * Shorthand for a path of literal keys only, e.g. {@code keys("properties")}.
     */
    public static IgnoredSubtreePath keys(String... keys) {
        return new IgnoredSubtreePath(Arrays.stream(keys).map(SegmentMatcher::literal).toList());
    }

    public boolean isPrefixOf(List<PathSegment> path) {
        if (path.size() < matchers.size()) {
            return false;
        }
        for (int i = 0; i < matchers.size(); i++) {
            if (!matchers.get(i).matches(path.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return matchers.stream().map(SegmentMatcher::toString).collect(Collectors.joining("."));
    }
}
