package io.reactormesh.observability;

public record UnitCounters(
        String unitId,
        boolean enabled,
        String disabledReason,
        long success,
        long failed,
        long suppressed,
        long quarantined,
        long deferred,
        long timeouts,
        long conflicts,
        long accessDenied,
        int timeoutStreak,
        long lastFiredAtMs
) {
}
