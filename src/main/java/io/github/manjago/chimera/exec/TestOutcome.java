package io.github.manjago.chimera.exec;

/**
 * Result of running one test.
 */
public enum TestOutcome {
    PASS,
    FAIL,
    /** The test raised an unexpected exception */
    THREW;

    /**
     * True if the outcome detects a mutant: an assertion failure or an
     * exception both count.
     */
    public boolean detects() {
        return this != PASS;
    }
}
