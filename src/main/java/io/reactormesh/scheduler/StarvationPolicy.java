package io.reactormesh.scheduler;

import io.reactormesh.model.MutexQueueEntry;

/**
 * Effective priority of a waiting entry: its static priority until the wait passes
 * {@code thresholdMs}, then {@code boostStep} more per {@code boostIntervalMs} of extra
 * wait. Recomputed from elapsed time, never compounded, and capped one above the
 * highest static priority in the group.
 */
public record StarvationPolicy(long thresholdMs, long boostIntervalMs, double boostStep) {
    public StarvationPolicy {
        thresholdMs = Math.max(0L, thresholdMs);
        boostIntervalMs = Math.max(1L, boostIntervalMs);
        boostStep = boostStep <= 0.0d ? 1.0d : boostStep;
    }

    public double effectivePriority(MutexQueueEntry entry, long nowMs, int groupMaxPriority) {
        long waited = nowMs - entry.enqueuedAtMs();
        double base = entry.staticPriority();
        if (waited <= thresholdMs) {
            return base;
        }
        double boosted = base + boostStep * (waited - thresholdMs) / (double) boostIntervalMs;
        double cap = Math.max(base, groupMaxPriority + 1.0d);
        return Math.min(cap, boosted);
    }
}
