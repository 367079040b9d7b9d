package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.syntax.Coordinate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable test coverage: the forward map test → locations and the inverse
 * map location → tests.
 * <p>
 * Only the forward map is ever built; the inverse is derived from it in the
 * constructor, so it is always a pure function of the records.
 */
public final class CoverageIndex {

    public static final CoverageIndex EMPTY = new CoverageIndex(Map.of());

    private final Map<String, Set<Location>> forward;
    private final Map<Location, Set<String>> inverse;
    private final Map<String, Set<String>> byForm;

    private CoverageIndex(Map<String, Set<Location>> forward) {
        Map<String, Set<Location>> fwd = new TreeMap<>();
        Map<Location, Set<String>> inv = new HashMap<>();
        Map<String, Set<String>> forms = new HashMap<>();
        for (Map.Entry<String, Set<Location>> e : forward.entrySet()) {
            fwd.put(e.getKey(), Set.copyOf(e.getValue()));
            for (Location location : e.getValue()) {
                inv.computeIfAbsent(location, k -> new HashSet<>()).add(e.getKey());
                forms.computeIfAbsent(location.formId(), k -> new HashSet<>()).add(e.getKey());
            }
        }
        this.forward = Collections.unmodifiableMap(fwd);
        this.inverse = freeze(inv);
        this.byForm = freeze(forms);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fold events into an index; repeated events for one test union.
     */
    public static CoverageIndex fold(Iterable<TraceEvent> events) {
        return builder().addAll(events).build();
    }

    public static CoverageIndex of(Collection<CoverageRecord> records) {
        Builder builder = builder();
        records.forEach(builder::add);
        return builder.build();
    }

    /**
     * Union of several indexes. Commutative and idempotent.
     */
    public static CoverageIndex merge(Collection<CoverageIndex> indexes) {
        Builder builder = builder();
        for (CoverageIndex index : indexes) {
            index.records().forEach(builder::add);
        }
        return builder.build();
    }

    /**
     * Tests covering the location; empty when nothing covers it or the key is unknown.
     */
    public Set<String> testsFor(String formId, Coordinate coordinate) {
        return inverse.getOrDefault(new Location(formId, coordinate), Set.of());
    }

    /**
     * Tests covering any location of the form.
     */
    public Set<String> testsForForm(String formId) {
        return byForm.getOrDefault(formId, Set.of());
    }

    public Set<Location> locationsOf(String testId) {
        return forward.getOrDefault(testId, Set.of());
    }

    public Set<String> testIds() {
        return forward.keySet();
    }

    public List<CoverageRecord> records() {
        List<CoverageRecord> records = new ArrayList<>(forward.size());
        forward.forEach((test, locations) -> records.add(new CoverageRecord(test, locations)));
        return records;
    }

    public int locationCount() {
        return inverse.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CoverageIndex other && forward.equals(other.forward);
    }

    @Override
    public int hashCode() {
        return forward.hashCode();
    }

    @Override
    public String toString() {
        return "CoverageIndex[tests=" + forward.size() + ", locations=" + inverse.size() + "]";
    }

    /** Test sets are sorted so selection order is deterministic */
    private static <K> Map<K, Set<String>> freeze(Map<K, Set<String>> map) {
        Map<K, Set<String>> frozen = new HashMap<>(map.size());
        map.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(new TreeSet<>(v))));
        return Collections.unmodifiableMap(frozen);
    }

    // ========== Builder ==========

    public static final class Builder {

        private final Map<String, Set<Location>> forward = new HashMap<>();

        private Builder() {}

        public Builder add(TraceEvent event) {
            forward.computeIfAbsent(event.testId(), k -> new HashSet<>()).add(event.location());
            return this;
        }

        public Builder addAll(Iterable<TraceEvent> events) {
            for (TraceEvent event : events) {
                add(event);
            }
            return this;
        }

        public Builder add(CoverageRecord record) {
            forward.computeIfAbsent(record.testId(), k -> new HashSet<>()).addAll(record.locations());
            return this;
        }

        /**
         * Register a test that touched nothing, so it still appears among the test ids.
         */
        public Builder addTest(String testId) {
            forward.computeIfAbsent(testId, k -> new HashSet<>());
            return this;
        }

        public CoverageIndex build() {
            return new CoverageIndex(forward);
        }
    }
}
