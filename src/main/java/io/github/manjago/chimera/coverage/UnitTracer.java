package io.github.manjago.chimera.coverage;

import java.io.IOException;

/**
 * Produces fresh coverage for one test unit.
 */
@FunctionalInterface
public interface UnitTracer {

    CoverageUnit trace(TestUnit unit) throws IOException;
}
