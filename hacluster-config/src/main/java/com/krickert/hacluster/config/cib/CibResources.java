package com.krickert.hacluster.config.cib;

import com.krickert.hacluster.config.cib.model.CibElement;

import java.util.Optional;
import java.util.Set;

/**
 * Resource element tags and lookups.
 */
public final class CibResources {

    public static final String TAG_PRIMITIVE = "primitive";
    public static final String TAG_GROUP = "group";
    public static final String TAG_CLONE = "clone";
    public static final String TAG_MASTER = "master";
    public static final String TAG_BUNDLE = "bundle";

    /** Wrappers running their resource in multiple instances. */
    public static final Set<String> TAGS_CLONE = Set.of(TAG_CLONE, TAG_MASTER);
    public static final Set<String> TAGS_ALL = Set.of(TAG_PRIMITIVE, TAG_GROUP, TAG_CLONE, TAG_MASTER, TAG_BUNDLE);

    private CibResources() {
    }

    /**
     * Finds a resource of any kind by id. Elements of other kinds sharing the id are ignored.
     */
    public static Optional<CibElement> findResource(CibElement tree, String resourceId) {
        return tree.findById(resourceId, TAGS_ALL);
    }

    public static boolean isClone(CibElement element) {
        return TAGS_CLONE.contains(element.getTag());
    }
}
