package io.reactormesh.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.acl.AccessDeniedException;
import io.reactormesh.acl.AclRegistry;
import io.reactormesh.config.EngineSettings;
import io.reactormesh.model.ExecutionPolicy;
import io.reactormesh.model.FailureReason;
import io.reactormesh.model.MutexQueueEntry;
import io.reactormesh.model.Outcome;
import io.reactormesh.model.Snapshot;
import io.reactormesh.store.CommitResult;
import io.reactormesh.store.MeshCapacityException;
import io.reactormesh.store.MeshCorruptionException;
import io.reactormesh.store.MeshState;
import io.reactormesh.store.PendingWrite;
import io.reactormesh.store.SnapshotManager;
import io.reactormesh.store.ValueTooLargeException;
import io.reactormesh.store.VersionStore;
import io.reactormesh.throttle.ThrottleMonitor;
import io.reactormesh.trace.EngineEvent;
import io.reactormesh.trace.EvaluationRecord;
import io.reactormesh.trace.MutationRecord;
import io.reactormesh.trace.SecurityEvent;
import io.reactormesh.trace.TraceRecorder;
import io.reactormesh.unit.ExecutionCancelledException;
import io.reactormesh.unit.MeshHandle;
import io.reactormesh.unit.RegisteredUnit;
import io.reactormesh.unit.UnitDescriptor;
import io.reactormesh.unit.UnitRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The reactor cycle: Collect, Order, Admit, then Execute on a bounded worker pool,
 * with cooldown recorded when an execution settles.
 *
 * <p>Collect and Order are pure: they read one {@link MeshState} root and the unit
 * registry, and produce the same ordered list for the same inputs. Admit is the only
 * phase that changes scheduler state and it runs under {@code lock}, which worker
 * completions also take to release their mutex group.
 */
public final class Scheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);
    static final String QUARANTINE_REASON = "timeout_streak";

    private static final Comparator<Evaluation> ORDER = Comparator
            .comparingInt((Evaluation e) -> e.unit().descriptor().priority()).reversed()
            .thenComparingLong(e -> e.unit().registrationSeq());

    private final UnitRegistry registry;
    private final VersionStore store;
    private final SnapshotManager snapshots;
    private final ThrottleMonitor throttle;
    private final TraceRecorder trace;
    private final Clock clock;
    private final Object lock;
    private final MutexArbiter arbiter;
    private final Map<String, Execution> running;
    private final int workerQueueCapacity;
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService watchdog;
    private final AtomicLong cycleSeq;
    private final AtomicLong admittedTotal;
    private final AtomicLong queuedTotal;
    private final AtomicLong suppressedTotal;
    private final AtomicLong deferredTotal;
    private final AtomicLong succeededTotal;
    private final AtomicLong failedTotal;
    private final AtomicLong timeoutTotal;
    private final AtomicLong quarantinedTotal;
    private final AtomicLong interruptTotal;
    private final AtomicLong securityEventTotal;
    private volatile AclRegistry acl;
    private volatile EngineSettings settings;
    private volatile StarvationPolicy starvation;
    private volatile boolean halted;
    private volatile String haltReason;
    private volatile CycleReport lastReport;

    public Scheduler(
            UnitRegistry registry,
            VersionStore store,
            SnapshotManager snapshots,
            AclRegistry acl,
            ThrottleMonitor throttle,
            TraceRecorder trace,
            Clock clock,
            EngineSettings settings
    ) {
        this.registry = registry;
        this.store = store;
        this.snapshots = snapshots;
        this.acl = acl;
        this.throttle = throttle;
        this.trace = trace;
        this.clock = clock;
        this.lock = new Object();
        this.arbiter = new MutexArbiter();
        this.running = new HashMap<>();
        this.workerQueueCapacity = settings.workerQueueCapacity();
        this.workers = new ThreadPoolExecutor(
                settings.workerPoolSize(),
                settings.workerPoolSize(),
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(workerQueueCapacity),
                namedThreads("reactormesh-worker-"),
                new ThreadPoolExecutor.AbortPolicy()
        );
        this.watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads("reactormesh-watchdog-"));
        this.cycleSeq = new AtomicLong(0L);
        this.admittedTotal = new AtomicLong(0L);
        this.queuedTotal = new AtomicLong(0L);
        this.suppressedTotal = new AtomicLong(0L);
        this.deferredTotal = new AtomicLong(0L);
        this.succeededTotal = new AtomicLong(0L);
        this.failedTotal = new AtomicLong(0L);
        this.timeoutTotal = new AtomicLong(0L);
        this.quarantinedTotal = new AtomicLong(0L);
        this.interruptTotal = new AtomicLong(0L);
        this.securityEventTotal = new AtomicLong(0L);
        applySettings(settings);
    }

    public CycleReport runCycle() {
        if (halted) {
            throw new IllegalStateException("Reactor halted: " + haltReason);
        }
        long startedNs = System.nanoTime();
        long nowMs = clock.millis();
        long cycleId = cycleSeq.incrementAndGet();
        ThrottleMonitor.Mode mode = throttle.beginCycle(nowMs);
        double pressure = throttle.pressure();
        reenableExpired(nowMs);

        MeshState state;
        try {
            state = store.current();
        } catch (MeshCorruptionException e) {
            halt(e);
            throw e;
        }

        Set<String> busy;
        synchronized (lock) {
            busy = busyUnitIds();
        }
        List<Evaluation> evaluations = collect(state, nowMs, busy);
        List<Evaluation> matches = order(evaluations);
        CycleCounts counts = new CycleCounts();
        for (Evaluation evaluation : evaluations) {
            if (!evaluation.triggered()) {
                settleNotTriggered(evaluation, cycleId);
            }
        }
        synchronized (lock) {
            admit(cycleId, nowMs, state, matches, counts);
        }

        CycleReport report = new CycleReport(
                cycleId,
                state.commitSeq(),
                evaluations.size(),
                matches.size(),
                counts.admitted,
                counts.queued,
                counts.suppressed,
                counts.deferred,
                counts.interrupts,
                mode,
                pressure,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNs)
        );
        lastReport = report;
        if (report.evaluated() > 0) {
            logger.debug("Cycle {} evaluated={} triggered={} admitted={} queued={} suppressed={} deferred={} mode={}",
                    cycleId, report.evaluated(), report.triggered(), report.admitted(), report.queued(),
                    report.suppressed(), report.deferred(), mode);
        }
        return report;
    }

    public List<String> previewMatches(MeshState state) {
        Set<String> busy;
        synchronized (lock) {
            busy = busyUnitIds();
        }
        List<String> out = new ArrayList<>();
        for (Evaluation evaluation : order(collect(state, clock.millis(), busy))) {
            out.add(evaluation.unit().id());
        }
        return out;
    }

    List<Evaluation> collect(MeshState state, long nowMs, Set<String> busy) {
        List<Evaluation> out = new ArrayList<>();
        for (RegisteredUnit unit : registry.ordered()) {
            if (!unit.enabled() || busy.contains(unit.id())) {
                continue;
            }
            UnitDescriptor descriptor = unit.descriptor();
            if (!(unit.isDirty() || descriptor.temporal()) || unit.inCooldown(nowMs)) {
                continue;
            }
            Snapshot snapshot = snapshots.capture(state, descriptor.interests());
            out.add(evaluate(unit, snapshot));
        }
        return out;
    }

    static List<Evaluation> order(List<Evaluation> evaluations) {
        List<Evaluation> matches = new ArrayList<>();
        for (Evaluation evaluation : evaluations) {
            if (evaluation.triggered()) {
                matches.add(evaluation);
            }
        }
        matches.sort(ORDER);
        return matches;
    }

    private Evaluation evaluate(RegisteredUnit unit, Snapshot snapshot) {
        try {
            return new Evaluation(unit, snapshot, unit.descriptor().unit().trigger(snapshot), null);
        } catch (RuntimeException e) {
            logger.warn("Trigger of unit {} failed: {}", unit.id(), e.toString());
            return new Evaluation(unit, snapshot, false, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void settleNotTriggered(Evaluation evaluation, long cycleId) {
        evaluation.unit().clearDirty(evaluation.snapshot().commitSeq());
        if (evaluation.error() != null) {
            traceEvaluation(evaluation.unit(), evaluation.snapshot(), cycleId, false, EvaluationRecord.TRIGGER_ERROR);
        } else if (settings.traceNoopEvaluations()) {
            traceEvaluation(evaluation.unit(), evaluation.snapshot(), cycleId, false, EvaluationRecord.NOT_TRIGGERED);
        }
    }

    private void admit(long cycleId, long nowMs, MeshState state, List<Evaluation> matches, CycleCounts counts) {
        Set<String> contested = new HashSet<>();
        for (Evaluation match : matches) {
            if (match.unit().descriptor().mutexGroup() != null) {
                contested.add(match.unit().descriptor().mutexGroup());
            }
        }
        List<String> waitingGroups = new ArrayList<>();
        arbiter.groupsWithWaiting().forEach(waitingGroups::add);
        for (String group : waitingGroups) {
            if (!contested.contains(group)) {
                promoteWaiting(group, cycleId, nowMs, state, counts);
            }
        }
        for (Evaluation match : matches) {
            admitMatch(match, cycleId, nowMs, state, counts);
        }
    }

    private void promoteWaiting(String group, long cycleId, long nowMs, MeshState state, CycleCounts counts) {
        while (!arbiter.isBusy(group)) {
            MutexQueueEntry head = nextWaiting(group, cycleId, nowMs);
            if (head == null) {
                return;
            }
            Promotion promotion = promoteHead(group, head, cycleId, state, counts);
            if (promotion != Promotion.STALE) {
                return;
            }
        }
    }

    private void admitMatch(Evaluation match, long cycleId, long nowMs, MeshState state, CycleCounts counts) {
        RegisteredUnit unit = match.unit();
        String group = unit.descriptor().mutexGroup();
        if (group == null) {
            dispatchFresh(match, cycleId, counts);
            return;
        }
        while (true) {
            if (arbiter.isBusy(group)) {
                handleBusy(match, group, cycleId, nowMs, counts);
                return;
            }
            MutexQueueEntry head = nextWaiting(group, cycleId, nowMs);
            boolean waitingWins = head != null
                    && (head == arbiter.interrupter(group) || head.effectivePriority() >= unit.descriptor().priority());
            if (waitingWins) {
                Promotion promotion = promoteHead(group, head, cycleId, state, counts);
                if (promotion != Promotion.BLOCKED) {
                    continue;
                }
            }
            dispatchFresh(match, cycleId, counts);
            return;
        }
    }

    private MutexQueueEntry nextWaiting(String group, long cycleId, long nowMs) {
        MutexQueueEntry interrupter = arbiter.interrupter(group);
        if (interrupter != null) {
            return interrupter;
        }
        return arbiter.queue(group).peek(cycleId, nowMs, starvation, registry.maxPriorityInGroup(group));
    }

    private Promotion promoteHead(String group, MutexQueueEntry head, long cycleId, MeshState state, CycleCounts counts) {
        RegisteredUnit unit = registry.findById(head.unitId()).orElse(null);
        if (unit == null || !unit.enabled()) {
            removeWaiting(group, head);
            return Promotion.STALE;
        }
        Snapshot snapshot = snapshots.capture(state, unit.descriptor().interests());
        Evaluation evaluation = evaluate(unit, snapshot);
        if (!evaluation.triggered()) {
            removeWaiting(group, head);
            settleNotTriggered(evaluation, cycleId);
            return Promotion.STALE;
        }
        ThrottleMonitor.Decision decision = throttle.tryAdmit(unit.descriptor().critical());
        if (decision != ThrottleMonitor.Decision.ADMIT) {
            recordDeferred(unit, snapshot, cycleId, decisionLabel(decision), counts);
            return Promotion.BLOCKED;
        }
        boolean wasInterrupter = head == arbiter.interrupter(group);
        removeWaiting(group, head);
        if (!dispatch(unit, snapshot, cycleId, counts)) {
            if (wasInterrupter) {
                arbiter.setInterrupter(group, head);
            } else {
                arbiter.queue(group).add(head);
            }
            return Promotion.BLOCKED;
        }
        return Promotion.DISPATCHED;
    }

    private void removeWaiting(String group, MutexQueueEntry entry) {
        if (entry == arbiter.interrupter(group)) {
            arbiter.clearInterrupter(group);
        } else {
            arbiter.queue(group).remove(entry.unitId());
        }
    }

    private void handleBusy(Evaluation match, String group, long cycleId, long nowMs, CycleCounts counts) {
        RegisteredUnit unit = match.unit();
        UnitDescriptor descriptor = unit.descriptor();
        Snapshot snapshot = match.snapshot();
        String owner = arbiter.owner(group).map(Execution::unitId).orElse("?");
        ExecutionPolicy policy = descriptor.executionPolicy();
        MutexQueueEntry entry = new MutexQueueEntry(unit.id(), group, nowMs, descriptor.priority(),
                unit.registrationSeq(), descriptor.priority());
        unit.clearDirty(snapshot.commitSeq());
        switch (policy) {
            case ABORT_LOWER -> {
                unit.record(Outcome.SUPPRESSED, null);
                suppressedTotal.incrementAndGet();
                counts.suppressed++;
                Instant now = clock.instant();
                trace.record(MutationRecord.withoutCommit(unit.id(), snapshot.id(), cycleId, now, now,
                        Outcome.SUPPRESSED, null, "mutex group " + group + " held by " + owner));
            }
            case INTERRUPT -> {
                if (arbiter.setInterrupter(group, entry)) {
                    arbiter.owner(group).ifPresent(execution -> {
                        if (execution.interrupt(unit.id())) {
                            logger.info("Unit {} interrupts {} in mutex group {}", unit.id(), execution.unitId(), group);
                        }
                    });
                    interruptTotal.incrementAndGet();
                    counts.interrupts++;
                    traceEvaluation(unit, snapshot, cycleId, true, EvaluationRecord.INTERRUPT_REQUESTED);
                } else {
                    enqueue(entry, unit, snapshot, cycleId, counts);
                }
            }
            default -> enqueue(entry, unit, snapshot, cycleId, counts);
        }
    }

    private void enqueue(MutexQueueEntry entry, RegisteredUnit unit, Snapshot snapshot, long cycleId, CycleCounts counts) {
        arbiter.queue(entry.mutexGroup()).add(entry);
        queuedTotal.incrementAndGet();
        counts.queued++;
        traceEvaluation(unit, snapshot, cycleId, true, EvaluationRecord.QUEUED);
    }

    private void dispatchFresh(Evaluation match, long cycleId, CycleCounts counts) {
        RegisteredUnit unit = match.unit();
        ThrottleMonitor.Decision decision = throttle.tryAdmit(unit.descriptor().critical());
        if (decision != ThrottleMonitor.Decision.ADMIT) {
            recordDeferred(unit, match.snapshot(), cycleId, decisionLabel(decision), counts);
            return;
        }
        dispatch(unit, match.snapshot(), cycleId, counts);
    }

    private boolean dispatch(RegisteredUnit unit, Snapshot snapshot, long cycleId, CycleCounts counts) {
        UnitDescriptor descriptor = unit.descriptor();
        long timeoutMs = descriptor.timeout() == null
                ? settings.defaultUnitTimeoutMs()
                : descriptor.timeout().toMillis();
        Execution execution = new Execution(unit, snapshot, cycleId, clock.instant(), timeoutMs);
        String group = descriptor.mutexGroup();
        if (group != null) {
            arbiter.claim(group, execution);
        }
        running.put(unit.id(), execution);
        unit.clearDirty(snapshot.commitSeq());
        try {
            workers.execute(() -> runExecution(execution));
        } catch (RejectedExecutionException e) {
            running.remove(unit.id());
            if (group != null) {
                arbiter.release(group, execution);
            }
            unit.forceDirty();
            recordDeferred(unit, snapshot, cycleId, EvaluationRecord.DEFERRED_SATURATED, counts);
            return false;
        }
        admittedTotal.incrementAndGet();
        counts.admitted++;
        return true;
    }

    private void runExecution(Execution execution) {
        RegisteredUnit unit = execution.unit();
        String unitId = unit.id();
        if (!execution.start(clock.instant())) {
            complete(execution, Outcome.FAILED, FailureReason.CANCELLED,
                    "cancelled before a worker picked it up: " + execution.cancellation().reason(), null, List.of());
            return;
        }
        try {
            execution.watchdog(watchdog.schedule(() -> onDeadline(execution), execution.timeoutMs(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            logger.warn("Watchdog is shut down; unit {} runs without a deadline", unitId);
        }
        MeshHandle handle = new MeshHandle(
                unitId,
                execution.cycleId(),
                execution.snapshot(),
                unit.descriptor().interests(),
                store,
                acl,
                settings.maxKeysPerExecution(),
                execution.cancellation(),
                denied -> recordSecurity(denied, execution.cycleId())
        );
        Outcome outcome = Outcome.FAILED;
        FailureReason reason = null;
        String detail = null;
        CommitResult commit = null;
        List<PendingWrite> writes = List.of();
        try {
            unit.descriptor().unit().act(handle);
            writes = handle.seal();
            if (!execution.beginCommit()) {
                reason = FailureReason.TIMEOUT;
                detail = "deadline passed before commit";
            } else if (writes.isEmpty()) {
                outcome = Outcome.SUCCESS;
            } else {
                commit = store.commit(unitId, writes);
                if (commit.committed()) {
                    outcome = Outcome.SUCCESS;
                } else {
                    reason = FailureReason.VERSION_CONFLICT;
                    detail = describeConflicts(commit.conflicts());
                }
            }
        } catch (ExecutionCancelledException e) {
            reason = execution.state() == Execution.State.TIMED_OUT ? FailureReason.TIMEOUT : FailureReason.CANCELLED;
            detail = e.getMessage();
        } catch (AccessDeniedException e) {
            reason = FailureReason.ACCESS_DENIED;
            detail = e.getMessage();
        } catch (ValueTooLargeException e) {
            reason = FailureReason.VALUE_TOO_LARGE;
            detail = e.getMessage();
        } catch (MeshCapacityException e) {
            reason = FailureReason.CAPACITY_EXCEEDED;
            detail = e.getMessage();
        } catch (MeshCorruptionException e) {
            reason = FailureReason.ERROR;
            detail = e.getMessage();
            halt(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = FailureReason.CANCELLED;
            detail = "worker interrupted";
        } catch (Exception e) {
            reason = FailureReason.ERROR;
            detail = e.getClass().getSimpleName() + ": " + e.getMessage();
            logger.warn("Unit {} failed in cycle {}", unitId, execution.cycleId(), e);
        } finally {
            handle.seal();
            complete(execution, outcome, reason, detail, commit, writes);
        }
    }

    private void complete(
            Execution execution,
            Outcome outcome,
            FailureReason reason,
            String detail,
            CommitResult commit,
            List<PendingWrite> writes
    ) {
        execution.cancelWatchdog();
        try {
            if (execution.finish()) {
                settle(execution, outcome, reason, detail, commit, writes);
            } else {
                logger.debug("Unit {} returned after its deadline; outcome already recorded", execution.unitId());
            }
        } finally {
            synchronized (lock) {
                running.remove(execution.unitId(), execution);
                String group = execution.unit().descriptor().mutexGroup();
                if (group != null) {
                    arbiter.release(group, execution);
                }
                lock.notifyAll();
            }
        }
    }

    private void settle(
            Execution execution,
            Outcome outcome,
            FailureReason reason,
            String detail,
            CommitResult commit,
            List<PendingWrite> writes
    ) {
        RegisteredUnit unit = execution.unit();
        Instant finishedAt = clock.instant();
        unit.recordFired(finishedAt.toEpochMilli());
        unit.record(outcome, reason);
        unit.resetTimeoutStreak();
        if (outcome == Outcome.SUCCESS) {
            succeededTotal.incrementAndGet();
        } else {
            failedTotal.incrementAndGet();
            unit.forceDirty();
            if (reason == FailureReason.VERSION_CONFLICT || reason == FailureReason.CANCELLED) {
                logger.debug("Unit {} failed with {}: {}", unit.id(), reason, detail);
            } else {
                logger.warn("Unit {} failed with {}: {}", unit.id(), reason, detail);
            }
        }
        Snapshot snapshot = execution.snapshot();
        if (commit != null && commit.committed()) {
            Map<String, JsonNode> after = new LinkedHashMap<>();
            for (PendingWrite write : writes) {
                after.put(write.key(), write.value());
            }
            trace.record(new MutationRecord(
                    unit.id(),
                    snapshot.id(),
                    execution.cycleId(),
                    new ArrayList<>(commit.newVersions().keySet()),
                    commit.before(),
                    after,
                    execution.startedAt(),
                    finishedAt,
                    outcome,
                    null,
                    commit.commitSeq(),
                    null
            ));
        } else {
            trace.record(MutationRecord.withoutCommit(unit.id(), snapshot.id(), execution.cycleId(),
                    execution.startedAt(), finishedAt, outcome, reason, detail));
        }
    }

    private void onDeadline(Execution execution) {
        if (!execution.markTimedOut()) {
            return;
        }
        RegisteredUnit unit = execution.unit();
        execution.cancellation().cancel("timeout after " + execution.timeoutMs() + " ms");
        Instant now = clock.instant();
        unit.recordFired(now.toEpochMilli());
        unit.record(Outcome.FAILED, FailureReason.TIMEOUT);
        unit.forceDirty();
        timeoutTotal.incrementAndGet();
        failedTotal.incrementAndGet();
        int streak = unit.incrementTimeoutStreak();
        logger.warn("Unit {} exceeded its {} ms deadline ({} consecutive)", unit.id(), execution.timeoutMs(), streak);
        trace.record(MutationRecord.withoutCommit(unit.id(), execution.snapshot().id(), execution.cycleId(),
                execution.startedAt(), now, Outcome.FAILED, FailureReason.TIMEOUT,
                "deadline " + execution.timeoutMs() + " ms exceeded"));
        if (streak >= settings.timeoutStreakLimit()) {
            quarantine(unit, execution, streak, now);
        }
    }

    private void quarantine(RegisteredUnit unit, Execution execution, int streak, Instant now) {
        if (registry.findById(unit.id()).orElse(null) != unit) {
            logger.info("Unit {} was deregistered before it could be quarantined", unit.id());
            return;
        }
        if (!registry.setEnabled(unit, false, QUARANTINE_REASON, now.toEpochMilli())) {
            return;
        }
        synchronized (lock) {
            arbiter.purge(unit.id());
        }
        unit.record(Outcome.QUARANTINED, null);
        quarantinedTotal.incrementAndGet();
        logger.error("Unit {} disabled after {} consecutive timeouts", unit.id(), streak);
        trace.record(MutationRecord.withoutCommit(unit.id(), execution.snapshot().id(), execution.cycleId(),
                execution.startedAt(), now, Outcome.QUARANTINED, FailureReason.TIMEOUT,
                "disabled after " + streak + " consecutive timeouts"));
        trace.record(EngineEvent.of(EngineEvent.QUARANTINED, unit.id(), now, Map.of("timeout_streak", streak)));
    }

    private void reenableExpired(long nowMs) {
        long after = settings.autoReenableAfterMs();
        if (after <= 0L) {
            return;
        }
        for (RegisteredUnit unit : registry.ordered()) {
            if (unit.enabled() || !QUARANTINE_REASON.equals(unit.disabledReason())) {
                continue;
            }
            if (nowMs - unit.disabledAtMs() >= after && registry.setEnabled(unit, true, null, nowMs)) {
                logger.info("Unit {} re-enabled after {} ms in quarantine", unit.id(), after);
                trace.record(EngineEvent.of(EngineEvent.REENABLED, unit.id(), clock.instant(), Map.of("automatic", true)));
            }
        }
    }

    private void recordDeferred(RegisteredUnit unit, Snapshot snapshot, long cycleId, String decision, CycleCounts counts) {
        unit.record(Outcome.DEFERRED, null);
        deferredTotal.incrementAndGet();
        counts.deferred++;
        traceEvaluation(unit, snapshot, cycleId, true, decision);
    }

    private void recordSecurity(AccessDeniedException denied, long cycleId) {
        securityEventTotal.incrementAndGet();
        logger.warn("Access denied: {}", denied.getMessage());
        trace.record(new SecurityEvent(denied.unitId(), denied.key(), denied.operation(), cycleId, clock.instant()));
    }

    private void traceEvaluation(RegisteredUnit unit, Snapshot snapshot, long cycleId, boolean triggered, String decision) {
        trace.record(new EvaluationRecord(unit.id(), snapshot.id(), cycleId, clock.instant(), triggered, decision));
    }

    public void forget(String unitId) {
        synchronized (lock) {
            arbiter.purge(unitId);
            Execution execution = running.get(unitId);
            if (execution != null) {
                execution.cancellation().cancel("deregistered");
            }
        }
    }

    public void halt(MeshCorruptionException cause) {
        synchronized (lock) {
            if (halted) {
                return;
            }
            halted = true;
            haltReason = cause.getMessage();
        }
        logger.error("Mesh corruption detected, reactor halted: {}", cause.getMessage(), cause);
        trace.record(EngineEvent.of(EngineEvent.HALTED, null, clock.instant(), Map.of("reason", String.valueOf(cause.getMessage()))));
    }

    public boolean halted() {
        return halted;
    }

    public String haltReason() {
        return haltReason;
    }

    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (!running.isEmpty()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0L) {
                    return false;
                }
                try {
                    lock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public void applySettings(EngineSettings next) {
        this.settings = next;
        this.starvation = new StarvationPolicy(
                next.starvationThresholdMs(),
                next.starvationBoostIntervalMs(),
                next.starvationBoostStep()
        );
        int size = next.workerPoolSize();
        if (size > workers.getMaximumPoolSize()) {
            workers.setMaximumPoolSize(size);
            workers.setCorePoolSize(size);
        } else if (size < workers.getMaximumPoolSize()) {
            workers.setCorePoolSize(size);
            workers.setMaximumPoolSize(size);
        }
    }

    public void setAcl(AclRegistry acl) {
        this.acl = acl;
    }

    public double workerQueuePressure() {
        return workers.getQueue().size() / (double) Math.max(1, workerQueueCapacity);
    }

    public Map<String, Integer> queueDepths() {
        synchronized (lock) {
            return arbiter.queueDepths();
        }
    }

    public Map<String, String> groupOwners() {
        synchronized (lock) {
            return arbiter.owners();
        }
    }

    public List<MutexQueueEntry> queuedEntries(String group) {
        synchronized (lock) {
            return arbiter.queue(group).entries();
        }
    }

    public Set<String> runningUnits() {
        synchronized (lock) {
            return Set.copyOf(running.keySet());
        }
    }

    public boolean isWaiting(String unitId) {
        synchronized (lock) {
            return arbiter.isWaiting(unitId);
        }
    }

    public SchedulerCounters counters() {
        return new SchedulerCounters(
                cycleSeq.get(),
                admittedTotal.get(),
                queuedTotal.get(),
                suppressedTotal.get(),
                deferredTotal.get(),
                succeededTotal.get(),
                failedTotal.get(),
                timeoutTotal.get(),
                quarantinedTotal.get(),
                interruptTotal.get(),
                securityEventTotal.get()
        );
    }

    public CycleReport lastReport() {
        return lastReport;
    }

    @Override
    public void close() {
        workers.shutdown();
        synchronized (lock) {
            for (Execution execution : running.values()) {
                execution.cancellation().cancel("shutdown");
            }
        }
        try {
            if (!workers.awaitTermination(5L, TimeUnit.SECONDS)) {
                logger.warn("Workers still busy after shutdown grace period; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        watchdog.shutdownNow();
    }

    private Set<String> busyUnitIds() {
        Set<String> busy = new HashSet<>(running.keySet());
        for (RegisteredUnit unit : registry.ordered()) {
            if (arbiter.isWaiting(unit.id())) {
                busy.add(unit.id());
            }
        }
        return busy;
    }

    private static String decisionLabel(ThrottleMonitor.Decision decision) {
        return decision == ThrottleMonitor.Decision.DEFERRED_EMERGENCY
                ? EvaluationRecord.DEFERRED_EMERGENCY
                : EvaluationRecord.DEFERRED_BUDGET;
    }

    private static String describeConflicts(List<CommitResult.Conflict> conflicts) {
        StringBuilder sb = new StringBuilder("version conflict on ");
        for (int i = 0; i < conflicts.size(); i++) {
            CommitResult.Conflict c = conflicts.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            if (c.missing()) {
                sb.append(c.key()).append(" (nothing to delete at version ").append(c.actualVersion()).append(')');
            } else {
                sb.append(c.key()).append(" (expected ").append(c.expectedVersion())
                        .append(", found ").append(c.actualVersion()).append(')');
            }
        }
        return sb.toString();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    record Evaluation(RegisteredUnit unit, Snapshot snapshot, boolean triggered, String error) {
    }

    private enum Promotion {
        DISPATCHED,
        STALE,
        BLOCKED
    }

    private static final class CycleCounts {
        private int admitted;
        private int queued;
        private int suppressed;
        private int deferred;
        private int interrupts;
    }

    public record SchedulerCounters(
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
            long securityEvents
    ) {
    }
}
