package io.github.manjago.chimera.operator;

/**
 * Named operator subsets trading thoroughness for speed.
 */
public enum Preset {

    /** Dominance-minimal operators with hardness of at least 3 */
    MINIMAL,

    /** Everything except constant tweaks and call removal */
    STANDARD,

    /** Every operator in the catalog */
    THOROUGH
}
