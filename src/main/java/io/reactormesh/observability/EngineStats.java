package io.reactormesh.observability;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time engine counters, as printed by {@code stats} and exported as metrics.
 */
public record EngineStats(
        boolean halted,
        String haltReason,
        long commitSeq,
        int meshEntries,
        long commits,
        long keysWritten,
        long versionConflicts,
        long commitRetries,
        String backend,
        long backendFailures,
        int backendBacklog,
        double pressure,
        double externalPressure,
        String throttleMode,
        int admissionBudget,
        int admittedInWindow,
        double mutationRatePerSecond,
        long mutationsTotal,
        long cycles,
        long admitted,
        long queued,
        long suppressed,
        long deferred,
        long succeeded,
        long failed,
        long timeouts,
        long quarantined,
        long interrupts,
        long securityEvents,
        long ingestAccepted,
        long ingestConflicts,
        long ingestRejected,
        int unitsRegistered,
        int unitsEnabled,
        int unitsRunning,
        Map<String, Integer> mutexQueueDepth,
        String traceSink,
        boolean traceSinkAvailable,
        long traceWritten,
        long traceDropped,
        long traceSampledOut,
        int traceBuffered,
        long traceFailedWrites,
        List<UnitCounters> units
) {
}
