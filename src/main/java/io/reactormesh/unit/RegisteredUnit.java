package io.reactormesh.unit;

import io.reactormesh.model.FailureReason;
import io.reactormesh.model.Outcome;
import io.reactormesh.observability.UnitCounters;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A descriptor plus the mutable runtime state the engine keeps for it.
 */
public final class RegisteredUnit {
    private final UnitDescriptor descriptor;
    private final long registrationSeq;
    private final AtomicLong dirtiedAtSeq;
    private final AtomicLong evaluatedThroughSeq;
    private final AtomicBoolean forcedDirty;
    private final AtomicInteger timeoutStreak;
    private final AtomicLong success;
    private final AtomicLong failed;
    private final AtomicLong suppressed;
    private final AtomicLong quarantined;
    private final AtomicLong deferred;
    private final AtomicLong timeouts;
    private final AtomicLong conflicts;
    private final AtomicLong accessDenied;
    private volatile boolean enabled;
    private volatile String disabledReason;
    private volatile long disabledAtMs;
    private volatile long lastFiredAtMs;

    RegisteredUnit(UnitDescriptor descriptor, long registrationSeq) {
        this.descriptor = descriptor;
        this.registrationSeq = registrationSeq;
        // A fresh unit gets one evaluation against whatever state already exists.
        this.dirtiedAtSeq = new AtomicLong(0L);
        this.evaluatedThroughSeq = new AtomicLong(-1L);
        this.forcedDirty = new AtomicBoolean(false);
        this.timeoutStreak = new AtomicInteger(0);
        this.success = new AtomicLong(0L);
        this.failed = new AtomicLong(0L);
        this.suppressed = new AtomicLong(0L);
        this.quarantined = new AtomicLong(0L);
        this.deferred = new AtomicLong(0L);
        this.timeouts = new AtomicLong(0L);
        this.conflicts = new AtomicLong(0L);
        this.accessDenied = new AtomicLong(0L);
        this.enabled = true;
        this.disabledReason = null;
        this.disabledAtMs = -1L;
        this.lastFiredAtMs = -1L;
    }

    public UnitDescriptor descriptor() {
        return descriptor;
    }

    public String id() {
        return descriptor.id();
    }

    public long registrationSeq() {
        return registrationSeq;
    }

    /**
     * True when a commit touching one of the unit's interests is newer than the last
     * snapshot it was evaluated against, or when a retry was forced.
     */
    public boolean isDirty() {
        return forcedDirty.get() || dirtiedAtSeq.get() > evaluatedThroughSeq.get();
    }

    public void markDirty(long commitSeq) {
        dirtiedAtSeq.accumulateAndGet(commitSeq, Math::max);
    }

    public void forceDirty() {
        forcedDirty.set(true);
    }

    /**
     * Records an evaluation against a snapshot taken at {@code commitSeq}. Commits after
     * that point keep the unit dirty.
     */
    public void clearDirty(long commitSeq) {
        forcedDirty.set(false);
        evaluatedThroughSeq.accumulateAndGet(commitSeq, Math::max);
    }

    public boolean enabled() {
        return enabled;
    }

    public String disabledReason() {
        return disabledReason;
    }

    public long disabledAtMs() {
        return disabledAtMs;
    }

    void disable(String reason, long nowMs) {
        this.enabled = false;
        this.disabledReason = reason;
        this.disabledAtMs = nowMs;
    }

    void enable() {
        this.timeoutStreak.set(0);
        this.disabledReason = null;
        this.disabledAtMs = -1L;
        this.enabled = true;
        this.forcedDirty.set(true);
    }

    public long lastFiredAtMs() {
        return lastFiredAtMs;
    }

    public void recordFired(long nowMs) {
        this.lastFiredAtMs = nowMs;
    }

    public boolean inCooldown(long nowMs) {
        long last = lastFiredAtMs;
        return last >= 0L && nowMs - last < descriptor.cooldown().toMillis();
    }

    public int timeoutStreak() {
        return timeoutStreak.get();
    }

    public int incrementTimeoutStreak() {
        return timeoutStreak.incrementAndGet();
    }

    public void resetTimeoutStreak() {
        timeoutStreak.set(0);
    }

    public void record(Outcome outcome, FailureReason reason) {
        switch (outcome) {
            case SUCCESS -> success.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            case SUPPRESSED -> suppressed.incrementAndGet();
            case QUARANTINED -> quarantined.incrementAndGet();
            case DEFERRED -> deferred.incrementAndGet();
            default -> throw new IllegalArgumentException("Unknown outcome: " + outcome);
        }
        if (reason == null) {
            return;
        }
        switch (reason) {
            case TIMEOUT -> timeouts.incrementAndGet();
            case VERSION_CONFLICT -> conflicts.incrementAndGet();
            case ACCESS_DENIED -> accessDenied.incrementAndGet();
            default -> {
            }
        }
    }

    public UnitCounters counters() {
        return new UnitCounters(
                descriptor.id(),
                enabled,
                disabledReason,
                success.get(),
                failed.get(),
                suppressed.get(),
                quarantined.get(),
                deferred.get(),
                timeouts.get(),
                conflicts.get(),
                accessDenied.get(),
                timeoutStreak.get(),
                lastFiredAtMs
        );
    }
}
