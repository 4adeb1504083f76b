package io.reactormesh.trace;

import java.time.Instant;

public record SecurityEvent(
        String unitId,
        String key,
        String operation,
        long cycleId,
        Instant at
) implements TraceRecord {
    @Override
    public String kind() {
        return "security";
    }
}
