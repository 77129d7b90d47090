package tech.yump.configserver.client;

import tech.yump.configserver.interpolation.IgnoredSubtreePath;

import java.util.ArrayList;
import java.util.List;

import static tech.yump.configserver.interpolation.SegmentMatcher.anyIndex;
import static tech.yump.configserver.interpolation.SegmentMatcher.anyKey;
import static tech.yump.configserver.interpolation.SegmentMatcher.literal;

/**
 * Manifest subtrees that hold job configuration rather than placeholders to resolve.
 */
public final class ManifestSubtrees {

    public static final List<IgnoredSubtreePath> DEPLOYMENT_MANIFEST = List.of(
            IgnoredSubtreePath.keys("properties"),
            IgnoredSubtreePath.of(literal("instance_groups"), anyIndex(), literal("properties")),
            IgnoredSubtreePath.of(literal("instance_groups"), anyIndex(), literal("jobs"), anyIndex(), literal("properties")),
            IgnoredSubtreePath.of(literal("instance_groups"), anyIndex(), literal("jobs"), anyIndex(),
                    literal("consumes"), anyKey(), literal("properties")),
            IgnoredSubtreePath.of(literal("jobs"), anyIndex(), literal("properties")),
            IgnoredSubtreePath.of(literal("jobs"), anyIndex(), literal("templates"), anyIndex(), literal("properties")),
            IgnoredSubtreePath.of(literal("jobs"), anyIndex(), literal("templates"), anyIndex(),
                    literal("consumes"), anyKey(), literal("properties")),
            IgnoredSubtreePath.of(literal("instance_groups"), anyIndex(), literal("env")),
            IgnoredSubtreePath.of(literal("jobs"), anyIndex(), literal("env")),
            IgnoredSubtreePath.of(literal("resource_pools"), anyIndex(), literal("env"))
    );

    public static final List<IgnoredSubtreePath> RUNTIME_MANIFEST = List.of(
            IgnoredSubtreePath.of(literal("addons"), anyIndex(), literal("properties")),
            IgnoredSubtreePath.of(literal("addons"), anyIndex(), literal("jobs"), anyIndex(), literal("properties")),
            IgnoredSubtreePath.of(literal("addons"), anyIndex(), literal("jobs"), anyIndex(),
                    literal("consumes"), anyKey(), literal("properties"))
    );

    static final IgnoredSubtreePath DEPLOYMENT_NAME = IgnoredSubtreePath.keys("name");

    private ManifestSubtrees() {
    }

    /**
     * Subtrees skipped by {@link ConfigServerClient#interpolateDeploymentManifest}: the deployment list plus the
     * top level {@code name}, which is the namespace of every relative name.
     */
    static List<IgnoredSubtreePath> forDeploymentManifest() {
        List<IgnoredSubtreePath> subtrees = new ArrayList<>(DEPLOYMENT_MANIFEST);
        subtrees.add(DEPLOYMENT_NAME);
        return List.copyOf(subtrees);
    }
}
