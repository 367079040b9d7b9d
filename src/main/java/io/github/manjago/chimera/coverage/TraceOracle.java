package io.github.manjago.chimera.coverage;

import java.util.List;

/**
 * Source of execution events, emitted while exactly one test runs.
 */
public interface TraceOracle {

    /** Discard buffered events before a test starts */
    void reset();

    /** Events buffered since the last reset */
    List<TraceEvent> drain();
}
