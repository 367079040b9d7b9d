package io.github.manjago.chimera.coverage;

import java.util.List;

/**
 * Persisted coverage of one test unit, valid for exactly one dependency hash.
 */
public record CoverageUnit(String unitId, String dependencyHash, List<String> testIds, List<CoverageRecord> records) {

    public CoverageUnit {
        testIds = List.copyOf(testIds);
        records = List.copyOf(records);
    }

    public CoverageIndex index() {
        CoverageIndex.Builder builder = CoverageIndex.builder();
        testIds.forEach(builder::addTest);
        records.forEach(builder::add);
        return builder.build();
    }

    /**
     * This unit, if it was built against the current dependency hash.
     *
     * @throws IndexStalenessException if the hashes differ
     */
    public CoverageUnit requireFresh(String currentHash) throws IndexStalenessException {
        if (!dependencyHash.equals(currentHash)) {
            throw new IndexStalenessException(unitId, dependencyHash, currentHash);
        }
        return this;
    }
}
