package tech.yump.configserver.interpolation;

import java.util.List;

/**
 * Decides whether a manifest path falls under one of the ignored subtrees.
 */
public final class SubtreeMatcher {

    private SubtreeMatcher() {
    }

    public static boolean isIgnored(List<PathSegment> path, List<IgnoredSubtreePath> ignoredSubtrees) {
        for (IgnoredSubtreePath ignored : ignoredSubtrees) {
            if (ignored.isPrefixOf(path)) {
                return true;
            }
        }
        return false;
    }
}
