package io.github.manjago.chimera.incremental;

/**
 * Why a form must be rescanned and retested.
 */
public enum ChangeReason {
    /** No digest stored for the form */
    NEW,
    /** Content differs from the stored digest */
    MODIFIED,
    /** Same content, different file */
    MOVED,
    /** Content unchanged but a covering test changed */
    TESTS_CHANGED
}
