package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.exec.TestOutcome;
import io.github.manjago.chimera.exec.TestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Traces a unit by running its tests one at a time against the oracle:
 * reset, run, drain, fold.
 * <p>
 * The oracle attributes events to whichever test is running, so tracing is
 * serialized on this collector even when several units refresh in parallel.
 */
public final class CoverageCollector implements UnitTracer {

    private static final Logger log = LoggerFactory.getLogger(CoverageCollector.class);

    private final TraceOracle oracle;
    private final TestRunner runner;
    private final ReentrantLock lock = new ReentrantLock();

    public CoverageCollector(TraceOracle oracle, TestRunner runner) {
        this.oracle = oracle;
        this.runner = runner;
    }

    @Override
    public CoverageUnit trace(TestUnit unit) {
        CoverageIndex.Builder builder = CoverageIndex.builder();
        for (String testId : unit.testIds()) {
            builder.addTest(testId);
            builder.addAll(traceTest(testId));
        }
        CoverageIndex index = builder.build();
        log.debug("Traced unit {}: {} tests, {} locations", unit.unitId(), unit.testIds().size(), index.locationCount());
        return new CoverageUnit(unit.unitId(), unit.dependencyHash(), unit.testIds(), index.records());
    }

    private List<TraceEvent> traceTest(String testId) {
        lock.lock();
        try {
            oracle.reset();
            try {
                TestOutcome outcome = runner.run(testId);
                if (outcome != TestOutcome.PASS) {
                    log.warn("Test {} does not pass on unmutated code ({}); its coverage is still recorded",
                            testId, outcome);
                }
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                log.warn("Test service failed while tracing {}: {}", testId, e.toString());
            }
            List<TraceEvent> events = new ArrayList<>();
            for (TraceEvent event : oracle.drain()) {
                if (!event.testId().equals(testId)) {
                    log.debug("Event for {} attributed while tracing {}", event.testId(), testId);
                }
                events.add(new TraceEvent(testId, event.formId(), event.coordinate()));
            }
            return events;
        } finally {
            lock.unlock();
        }
    }
}
