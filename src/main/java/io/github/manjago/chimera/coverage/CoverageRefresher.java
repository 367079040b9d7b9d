package io.github.manjago.chimera.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Brings stored coverage up to date with the current test units.
 * <p>
 * A stored unit is served only when its dependency hash matches; otherwise
 * (or when no unit is stored) it is traced again. Stale units are traced in
 * parallel, one task per unit, and the result is the union of fresh and
 * reused units.
 */
public final class CoverageRefresher {

    private static final Logger log = LoggerFactory.getLogger(CoverageRefresher.class);

    private final UnitTracer tracer;
    private final int parallelism;

    public CoverageRefresher(UnitTracer tracer, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.tracer = tracer;
        this.parallelism = parallelism;
    }

    /**
     * @param current units as they are now
     * @param stored  units from the previous run, by unit id
     */
    public Refresh refresh(Collection<TestUnit> current, Map<String, CoverageUnit> stored) throws IOException {
        Map<String, CoverageUnit> units = new LinkedHashMap<>();
        List<TestUnit> stale = new ArrayList<>();

        for (TestUnit unit : current) {
            CoverageUnit previous = stored.get(unit.unitId());
            if (previous == null) {
                stale.add(unit);
                continue;
            }
            try {
                units.put(unit.unitId(), previous.requireFresh(unit.dependencyHash()));
            } catch (IndexStalenessException e) {
                log.debug(e.getMessage());
                stale.add(unit);
            }
        }

        List<CoverageUnit> traced = traceAll(stale);
        Set<String> changedTests = new HashSet<>();
        for (CoverageUnit unit : traced) {
            units.put(unit.unitId(), unit);
            changedTests.addAll(unit.testIds());
            CoverageUnit previous = stored.get(unit.unitId());
            if (previous != null) {
                changedTests.addAll(previous.testIds());
            }
        }

        List<CoverageIndex> indexes = new ArrayList<>(units.size());
        for (CoverageUnit unit : units.values()) {
            indexes.add(unit.index());
        }
        CoverageIndex merged = CoverageIndex.merge(indexes);

        Set<String> recomputed = new HashSet<>();
        for (TestUnit unit : stale) {
            recomputed.add(unit.unitId());
        }
        log.info("Coverage: {} units reused, {} recomputed, {} tests, {} locations",
                units.size() - recomputed.size(), recomputed.size(), merged.testIds().size(), merged.locationCount());
        return new Refresh(merged, units, recomputed, changedTests);
    }

    private List<CoverageUnit> traceAll(List<TestUnit> stale) throws IOException {
        if (stale.isEmpty()) {
            return List.of();
        }
        if (parallelism == 1 || stale.size() == 1) {
            List<CoverageUnit> result = new ArrayList<>(stale.size());
            for (TestUnit unit : stale) {
                result.add(tracer.trace(unit));
            }
            return result;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, stale.size()));
        try {
            List<Future<CoverageUnit>> futures = new ArrayList<>(stale.size());
            for (TestUnit unit : stale) {
                futures.add(pool.submit(() -> tracer.trace(unit)));
            }
            List<CoverageUnit> result = new ArrayList<>(stale.size());
            for (Future<CoverageUnit> future : futures) {
                result.add(future.get());
            }
            return result;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("Coverage tracing failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while tracing coverage", e);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * @param index        merged coverage of every current unit
     * @param units        current units by id, fresh and reused
     * @param recomputed   ids of units that were traced in this refresh
     * @param changedTests tests of recomputed units, before and after
     */
    public record Refresh(CoverageIndex index, Map<String, CoverageUnit> units,
                          Set<String> recomputed, Set<String> changedTests) {
    }
}
