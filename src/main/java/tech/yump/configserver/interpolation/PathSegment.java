package tech.yump.configserver.interpolation;

/**
 * One step from a manifest node to one of its children.
 */
public sealed interface PathSegment permits PathSegment.Key, PathSegment.Index {

    static PathSegment key(String key) {
        return new Key(key);
    }

    static PathSegment index(int index) {
        return new Index(index);
    }

    /** A map key. */
    record Key(String name) implements PathSegment {
        @Override
        public String toString() {
            return name;
        }
    }

    /** A sequence position. */
    record Index(int position) implements PathSegment {
        public Index {
            if (position < 0) {
                throw new IllegalArgumentException("Sequence index cannot be negative: " + position);
            }
        }

        @Override
        public String toString() {
            return "[" + position + "]";
        }
    }
}
