package io.github.manjago.chimera.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the targeted tests of one mutant under a per-test time bound.
 * <p>
 * Up to {@code parallelism} tests run at once. The first detecting outcome to
 * complete stops the phase with {@code KILLED}; a test that overruns its bound is
 * cancelled together with every remaining test and yields {@code TIMEOUT}.
 * Worker threads are daemons so a test that ignores interruption cannot keep
 * the JVM alive.
 */
public final class TestExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

    private final TestRunner runner;
    private final Duration timeout;
    private final int parallelism;
    private final ExecutorService pool;

    public TestExecutor(TestRunner runner, Duration timeout, int parallelism) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.runner = runner;
        this.timeout = timeout;
        this.parallelism = parallelism;
        this.pool = Executors.newCachedThreadPool(daemonThreads());
    }

    public ExecutionResult execute(Collection<String> tests) {
        if (tests.isEmpty()) {
            return ExecutionResult.noCoverage();
        }
        List<String> ordered = new ArrayList<>(tests);
        int completed = 0;

        for (int start = 0; start < ordered.size(); start += parallelism) {
            List<String> chunk = ordered.subList(start, Math.min(start + parallelism, ordered.size()));
            CompletionService<TestOutcome> completion = new ExecutorCompletionService<>(pool);
            Map<Future<TestOutcome>, String> futures = new LinkedHashMap<>();
            for (String test : chunk) {
                futures.put(completion.submit(() -> runner.run(test)), test);
            }
            long deadline = System.nanoTime() + timeout.toNanos();

            // outcomes are taken in completion order, so a finished detecting
            // test is seen before a sibling that is still hanging
            for (int received = 0; received < futures.size(); received++) {
                Future<TestOutcome> done;
                try {
                    long remaining = Math.max(0, deadline - System.nanoTime());
                    done = completion.poll(remaining, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    cancelAll(futures.keySet());
                    Thread.currentThread().interrupt();
                    return new ExecutionResult(Verdict.ERROR, firstPending(futures), "interrupted", completed);
                }
                if (done == null) {
                    String test = firstPending(futures);
                    cancelAll(futures.keySet());
                    log.debug("Test {} exceeded {} ms", test, timeout.toMillis());
                    return new ExecutionResult(Verdict.TIMEOUT, test,
                            test + " exceeded " + timeout.toMillis() + " ms", completed);
                }

                String test = futures.get(done);
                try {
                    TestOutcome outcome = done.get();
                    completed++;
                    if (outcome.detects()) {
                        cancelAll(futures.keySet());
                        return new ExecutionResult(Verdict.KILLED, test, test + " " + outcome, completed);
                    }
                } catch (ExecutionException e) {
                    cancelAll(futures.keySet());
                    log.warn("Test service failed on {}: {}", test, e.getCause().toString());
                    return new ExecutionResult(Verdict.ERROR, test,
                            "test service failed: " + e.getCause(), completed);
                } catch (InterruptedException e) {
                    cancelAll(futures.keySet());
                    Thread.currentThread().interrupt();
                    return new ExecutionResult(Verdict.ERROR, test, "interrupted", completed);
                }
            }
        }
        return new ExecutionResult(Verdict.SURVIVED, null, completed + " tests passed", completed);
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    /**
     * First test of the chunk, in submission order, that has not finished.
     */
    private static String firstPending(Map<Future<TestOutcome>, String> futures) {
        for (Map.Entry<Future<TestOutcome>, String> entry : futures.entrySet()) {
            if (!entry.getKey().isDone()) {
                return entry.getValue();
            }
        }
        return futures.values().iterator().next();
    }

    private static void cancelAll(Collection<Future<TestOutcome>> futures) {
        for (Future<TestOutcome> future : futures) {
            future.cancel(true);
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "chimera-test-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
