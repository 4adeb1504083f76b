package io.reactormesh.scheduler;

import io.reactormesh.model.Snapshot;
import io.reactormesh.unit.CancellationToken;
import io.reactormesh.unit.RegisteredUnit;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One admitted run of a unit. PENDING until a worker picks it up; the deadline counts
 * from RUNNING. Worker (to COMMITTING) and watchdog (to TIMED_OUT) race on the state.
 */
public final class Execution {
    private final RegisteredUnit unit;
    private final Snapshot snapshot;
    private final long cycleId;
    private final Instant admittedAt;
    private final long timeoutMs;
    private final CancellationToken cancellation;
    private final AtomicReference<State> state;
    private volatile Instant startedAt;
    private volatile ScheduledFuture<?> watchdog;
    private volatile String interruptedBy;

    Execution(RegisteredUnit unit, Snapshot snapshot, long cycleId, Instant admittedAt, long timeoutMs) {
        this.unit = unit;
        this.snapshot = snapshot;
        this.cycleId = cycleId;
        this.admittedAt = admittedAt;
        this.timeoutMs = timeoutMs;
        this.cancellation = new CancellationToken();
        this.state = new AtomicReference<>(State.PENDING);
    }

    public RegisteredUnit unit() {
        return unit;
    }

    public String unitId() {
        return unit.id();
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public long cycleId() {
        return cycleId;
    }

    public Instant admittedAt() {
        return admittedAt;
    }

    // Admission time until a worker picks the run up.
    public Instant startedAt() {
        Instant started = startedAt;
        return started == null ? admittedAt : started;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public State state() {
        return state.get();
    }

    public String interruptedBy() {
        return interruptedBy;
    }

    boolean start(Instant now) {
        if (cancellation.isCancelled()) {
            return false;
        }
        if (!state.compareAndSet(State.PENDING, State.RUNNING)) {
            return false;
        }
        startedAt = now;
        return true;
    }

    boolean beginCommit() {
        return state.compareAndSet(State.RUNNING, State.COMMITTING);
    }

    boolean markTimedOut() {
        return state.compareAndSet(State.RUNNING, State.TIMED_OUT);
    }

    boolean finish() {
        return state.compareAndSet(State.PENDING, State.DONE)
                || state.compareAndSet(State.RUNNING, State.DONE)
                || state.compareAndSet(State.COMMITTING, State.DONE);
    }

    boolean interrupt(String byUnitId) {
        interruptedBy = byUnitId;
        return cancellation.cancel("interrupted by " + byUnitId);
    }

    void watchdog(ScheduledFuture<?> future) {
        this.watchdog = future;
    }

    void cancelWatchdog() {
        ScheduledFuture<?> future = watchdog;
        if (future != null) {
            future.cancel(false);
        }
    }

    public enum State {
        PENDING,
        RUNNING,
        COMMITTING,
        TIMED_OUT,
        DONE
    }
}
