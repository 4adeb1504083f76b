package io.reactormesh.scheduler;

import io.reactormesh.throttle.ThrottleMonitor;

public record CycleReport(
        long cycleId,
        long commitSeq,
        int evaluated,
        int triggered,
        int admitted,
        int queued,
        int suppressed,
        int deferred,
        int interrupts,
        ThrottleMonitor.Mode throttleMode,
        double pressure,
        long durationMs
) {
    public boolean degraded() {
        return throttleMode == ThrottleMonitor.Mode.EMERGENCY;
    }
}
