package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.syntax.Coordinate;

/**
 * A (form id, coordinate) pair as reported by the trace oracle.
 */
public record Location(String formId, Coordinate coordinate) {

    @Override
    public String toString() {
        return formId + "@" + coordinate;
    }
}
