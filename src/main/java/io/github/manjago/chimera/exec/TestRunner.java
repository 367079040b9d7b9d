package io.github.manjago.chimera.exec;

/**
 * Runs a single test in the process that holds the code under test.
 * Must be safely repeatable. An exception thrown from {@link #run} means the
 * service itself failed, not the test.
 */
@FunctionalInterface
public interface TestRunner {

    TestOutcome run(String testId) throws Exception;
}
