package io.reactormesh.model;

/**
 * A unit waiting for its mutex group. {@code effectivePriority} is the value computed
 * at the last re-key of the owning queue; it never decreases while the entry waits.
 */
public record MutexQueueEntry(
        String unitId,
        String mutexGroup,
        long enqueuedAtMs,
        int staticPriority,
        long registrationSeq,
        double effectivePriority
) {
    public MutexQueueEntry withEffectivePriority(double value) {
        return new MutexQueueEntry(unitId, mutexGroup, enqueuedAtMs, staticPriority, registrationSeq,
                Math.max(effectivePriority, value));
    }
}
