package io.github.manjago.chimera.operator;

/**
 * Broad operator groups, used by presets and by category clustering.
 */
public enum OperatorCategory {
    ARITHMETIC,
    RELATIONAL,
    LOGICAL,
    CONSTANT,
    COLLECTION,
    REMOVAL
}
