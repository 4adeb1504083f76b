package io.reactormesh.trace;

import java.time.Instant;

/**
 * What the scheduler decided for one unit in one cycle when no execution followed
 * directly (not triggered, queued, suppressed, deferred, skipped).
 */
public record EvaluationRecord(
        String unitId,
        long snapshotId,
        long cycleId,
        Instant at,
        boolean triggered,
        String decision
) implements TraceRecord {
    public static final String NOT_TRIGGERED = "not_triggered";
    public static final String ADMITTED = "admitted";
    public static final String QUEUED = "queued";
    public static final String SUPPRESSED = "suppressed";
    public static final String DEFERRED_BUDGET = "deferred_budget";
    public static final String DEFERRED_EMERGENCY = "deferred_emergency";
    public static final String DEFERRED_SATURATED = "deferred_saturated";
    public static final String INTERRUPT_REQUESTED = "interrupt_requested";
    public static final String TRIGGER_ERROR = "trigger_error";

    @Override
    public String kind() {
        return "evaluation";
    }
}
