package io.github.manjago.chimera.schemata;

/**
 * Runtime slot read by the schemata selector expression. Used strictly
 * sequentially within one process.
 */
public interface MutantSwitch {

    /** Make {@code mutantId} the active mutant */
    void select(int mutantId);

    /** Deactivate every mutant: compiled code behaves as the original */
    void clear();
}
