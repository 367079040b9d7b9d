package io.github.manjago.chimera.pipeline;

/**
 * Grouping used by {@link ClusterSelector}.
 */
public enum ClusterKey {

    /** No clustering: every site runs */
    NONE,

    /** Same operator id */
    OPERATOR,

    /** Same file and form, same first n coordinate segments */
    FORM_COORDINATE_PREFIX,

    /** Same operator category, parent node kind and parent head symbol */
    CATEGORY_PARENT_SHAPE
}
