package io.github.manjago.chimera.exec;

import org.jetbrains.annotations.Nullable;

/**
 * Verdict of running the targeted tests of one mutant.
 *
 * @param killingTest first test that detected the mutant, or the test that timed out
 * @param detail      short human-readable explanation
 * @param testsRun    tests that completed before the verdict was reached
 */
public record ExecutionResult(Verdict verdict, @Nullable String killingTest, String detail, int testsRun) {

    public static ExecutionResult noCoverage() {
        return new ExecutionResult(Verdict.NO_COVERAGE, null, "no covering tests", 0);
    }

    public static ExecutionResult error(String detail) {
        return new ExecutionResult(Verdict.ERROR, null, detail, 0);
    }
}
