package io.github.manjago.chimera.coverage;

/**
 * A stored coverage unit was built against different dependency content than
 * the current one. Never served; the unit is recomputed instead.
 */
public class IndexStalenessException extends Exception {

    private final String unitId;

    public IndexStalenessException(String unitId, String storedHash, String currentHash) {
        super(String.format("Coverage unit %s is stale: stored hash %s, current %s",
                unitId, abbreviate(storedHash), abbreviate(currentHash)));
        this.unitId = unitId;
    }

    public String getUnitId() {
        return unitId;
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
