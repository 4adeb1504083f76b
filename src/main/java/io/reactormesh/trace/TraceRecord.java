package io.reactormesh.trace;

import java.time.Instant;

/**
 * One entry of the append-only engine trace.
 */
public interface TraceRecord {
    String kind();

    String unitId();

    Instant at();
}
