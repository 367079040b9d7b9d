package io.github.manjago.chimera.coverage;

import java.util.Set;

/**
 * Every location one test touched.
 */
public record CoverageRecord(String testId, Set<Location> locations) {

    public CoverageRecord {
        locations = Set.copyOf(locations);
    }
}
