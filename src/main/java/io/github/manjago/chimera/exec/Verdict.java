package io.github.manjago.chimera.exec;

/**
 * Per-site outcome. Every state but {@link #PENDING} is terminal.
 */
public enum Verdict {
    PENDING,
    /** At least one targeted test failed or threw */
    KILLED,
    /** Every targeted test passed */
    SURVIVED,
    /** No test covers the site; nothing ran */
    NO_COVERAGE,
    /** A targeted test exceeded its time bound */
    TIMEOUT,
    /** Execution itself failed: apply, reload or the test service */
    ERROR;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * True if the verdict enters the score denominator.
     */
    public boolean isScored() {
        return this == KILLED || this == SURVIVED;
    }
}
