package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.syntax.Coordinate;

/**
 * One execution event: {@code testId} evaluated the expression at
 * {@code coordinate} of {@code formId}.
 */
public record TraceEvent(String testId, String formId, Coordinate coordinate) {

    public Location location() {
        return new Location(formId, coordinate);
    }
}
