package tech.yump.configserver.interpolation;

/**
 * Matches a single {@link PathSegment} inside an {@link IgnoredSubtreePath}.
 */
public sealed interface SegmentMatcher permits SegmentMatcher.Literal, SegmentMatcher.AnyIndex, SegmentMatcher.AnyKey {

    boolean matches(PathSegment segment);

    static SegmentMatcher literal(String key) {
        return new Literal(key);
    }

    static SegmentMatcher anyIndex() {
        return AnyIndex.INSTANCE;
    }

    static SegmentMatcher anyKey() {
        return AnyKey.INSTANCE;
    }

    /** Matches exactly one map key. */
    record Literal(String key) implements SegmentMatcher {
        @Override
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Key k && k.name().equals(key);
        }

        @Override
        public String toString() {
            return key;
        }
    }

    /** Matches any sequence position. */
    enum AnyIndex implements SegmentMatcher {
        INSTANCE;

        @Override
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Index;
        }

        @Override
        public String toString() {
            return "[*]";
        }
    }

    /** Matches any map key. */
    enum AnyKey implements SegmentMatcher {
        INSTANCE;

        @Override
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Key;
        }

        @Override
        public String toString() {
            return "*";
        }
    }
}
