package io.reactormesh.trace;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine-level decisions: quarantine, re-enable, halt, settings reload.
 */
public record EngineEvent(
        String event,
        String unitId,
        Instant at,
        Map<String, Object> details
) implements TraceRecord {
    public static final String QUARANTINED = "unit.quarantined";
    public static final String REENABLED = "unit.reenabled";
    public static final String DISABLED = "unit.disabled";
    public static final String REGISTERED = "unit.registered";
    public static final String DEREGISTERED = "unit.deregistered";
    public static final String HALTED = "reactor.halted";
    public static final String SETTINGS_RELOADED = "settings.reloaded";
    public static final String INGEST_REJECTED = "ingest.rejected";

    public EngineEvent {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static EngineEvent of(String event, String unitId, Instant at, Map<String, Object> details) {
        return new EngineEvent(event, unitId, at, details);
    }

    @Override
    public String kind() {
        return "engine";
    }
}
