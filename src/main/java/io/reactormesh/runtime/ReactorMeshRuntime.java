package io.reactormesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.reactormesh.acl.AclManifest;
import io.reactormesh.acl.AclRegistry;
import io.reactormesh.config.EngineSettings;
import io.reactormesh.config.ReactorMeshConfig;
import io.reactormesh.model.MeshEntry;
import io.reactormesh.model.Outcome;
import io.reactormesh.model.VersionedValue;
import io.reactormesh.observability.EngineStats;
import io.reactormesh.observability.PrometheusFormatter;
import io.reactormesh.observability.UnitCounters;
import io.reactormesh.scheduler.CycleReport;
import io.reactormesh.scheduler.Scheduler;
import io.reactormesh.store.CommitResult;
import io.reactormesh.store.Database;
import io.reactormesh.store.KeyPatterns;
import io.reactormesh.store.MeshBackend;
import io.reactormesh.store.MeshCapacityException;
import io.reactormesh.store.MeshCorruptionException;
import io.reactormesh.store.PendingWrite;
import io.reactormesh.store.SnapshotManager;
import io.reactormesh.store.SqliteMeshBackend;
import io.reactormesh.store.VersionStore;
import io.reactormesh.throttle.PressureProbe;
import io.reactormesh.throttle.ThrottleMonitor;
import io.reactormesh.trace.EngineEvent;
import io.reactormesh.trace.JsonlTraceSink;
import io.reactormesh.trace.MutationRecord;
import io.reactormesh.trace.SecurityEvent;
import io.reactormesh.trace.TraceRecorder;
import io.reactormesh.trace.TraceSink;
import io.reactormesh.unit.RegisteredUnit;
import io.reactormesh.unit.UnitCatalog;
import io.reactormesh.unit.UnitDescriptor;
import io.reactormesh.unit.UnitRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The Reactor: owns the mesh, the unit registry and the scheduler, and exposes the
 * ingest, registration and operator surfaces on top of them.
 */
public final class ReactorMeshRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReactorMeshRuntime.class);
    private static final int UNCONDITIONAL_WRITE_ATTEMPTS = 16;
    private static final long MAINTENANCE_INTERVAL_MS = 60_000L;

    private final ReactorMeshConfig config;
    private final Database database;
    private final MeshBackend backend;
    private final Clock clock;
    private final VersionStore store;
    private final SnapshotManager snapshots;
    private final UnitRegistry registry;
    private final ThrottleMonitor throttle;
    private final TraceSink traceSink;
    private final TraceRecorder trace;
    private final Scheduler scheduler;
    private final AutoCloseable storeSubscription;
    private final AtomicLong ingestAccepted;
    private final AtomicLong ingestConflicts;
    private final AtomicLong ingestRejected;
    private final Object loopLock;
    private ScheduledExecutorService loop;
    private volatile AclRegistry acl;
    private volatile EngineSettings settings;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;
    private volatile long lastMaintenanceAtMs;

    private ReactorMeshRuntime(
            ReactorMeshConfig config,
            Database database,
            MeshBackend backend,
            TraceSink traceSink,
            AclRegistry acl,
            EngineSettings settings,
            Clock clock
    ) {
        this.config = config;
        this.database = database;
        this.backend = backend;
        this.clock = clock;
        this.acl = acl;
        this.settings = settings;
        this.store = new VersionStore(backend, clock, settings.maxValueBytes(), settings.maxMeshKeys());
        this.snapshots = new SnapshotManager(store, clock);
        this.registry = new UnitRegistry();
        this.throttle = new ThrottleMonitor(settings);
        this.traceSink = traceSink;
        this.trace = new TraceRecorder(traceSink, settings.traceBufferCapacity(), settings.traceSamplingRate());
        this.scheduler = new Scheduler(registry, store, snapshots, acl, throttle, trace, clock, settings);
        this.ingestAccepted = new AtomicLong(0L);
        this.ingestConflicts = new AtomicLong(0L);
        this.ingestRejected = new AtomicLong(0L);
        this.loopLock = new Object();
        this.settingsFileMtimeMs = Long.MIN_VALUE;
        this.lastSettingsCheckMs = 0L;
        this.lastMaintenanceAtMs = clock.millis();
        this.storeSubscription = store.subscribe(AclRegistry.ANY, batch -> {
            registry.markDirty(batch.keys(), batch.commitSeq());
            throttle.recordMutations(batch.entries().size());
        });
        throttle.addProbe(new PressureProbe() {
            @Override
            public String name() {
                return "worker_queue";
            }

            @Override
            public double pressure() {
                return scheduler.workerQueuePressure();
            }
        });
        trace.start();
    }

    public static ReactorMeshRuntime open(ReactorMeshConfig config) {
        createDirectories(config.rootDir());
        createDirectories(config.traceArchiveRoot());
        Database database = new Database(config);
        database.init();
        EngineSettings settings = EngineSettings.load(config.settingsFile());
        AclRegistry acl;
        if (Files.exists(config.aclManifest())) {
            acl = AclRegistry.fromManifest(AclManifest.load(config.aclManifest()));
        } else {
            logger.warn("No ACL manifest at {}; every unit may read and write every key", config.aclManifest());
            acl = AclRegistry.permissive();
        }
        String signingSecret = loadOrCreateSigningSecret(config.traceSigningKey());
        Clock clock = Clock.systemUTC();
        JsonlTraceSink sink = new JsonlTraceSink(config.traceFile(), config.traceArchiveRoot(), signingSecret, clock);
        ReactorMeshRuntime runtime = new ReactorMeshRuntime(
                config, database, new SqliteMeshBackend(database), sink, acl, settings, clock);
        runtime.settingsFileMtimeMs = fileMtimeMs(config.settingsFile());
        try {
            runtime.store.restoreFromBackend();
        } catch (MeshCorruptionException e) {
            runtime.scheduler.halt(e);
        }
        for (UnitDescriptor descriptor : UnitCatalog.load(config.unitsFile())) {
            runtime.registerUnit(descriptor);
        }
        logger.info("Reactor opened at {} with {} keys and {} units",
                config.rootDir(), runtime.store.current().size(), runtime.registry.size());
        return runtime;
    }

    public static ReactorMeshRuntime inMemory(EngineSettings settings, AclRegistry acl, TraceSink sink, Clock clock) {
        return new ReactorMeshRuntime(null, null, MeshBackend.none(), sink, acl, settings, clock);
    }

    // ---- ingest ----

    /**
     * Writes {@code value} as the external {@code @ingest} principal. A null
     * {@code expectedVersion} overwrites whatever is current, except in a
     * read-only-forever namespace where only the first seed of a key is accepted.
     */
    public SubmitOutcome submitMutation(String key, JsonNode value, Long expectedVersion) {
        return ingest(key, value, expectedVersion, false);
    }

    public SubmitOutcome deleteMutation(String key, Long expectedVersion) {
        return ingest(key, null, expectedVersion, true);
    }

    private SubmitOutcome ingest(String key, JsonNode value, Long expectedVersion, boolean deletion) {
        ensureRunning();
        KeyPatterns.validateKey(key);
        if (expectedVersion != null && expectedVersion < 0L) {
            throw new IllegalArgumentException("expected version cannot be negative: " + expectedVersion);
        }
        AclRegistry rules = acl;
        boolean seedOnce = rules.governing(key).map(AclRegistry.Rule::readOnlyForever).orElse(false);
        int attempts = expectedVersion == null && !seedOnce ? UNCONDITIONAL_WRITE_ATTEMPTS : 1;
        String operation = deletion ? "delete" : "write";
        CommitResult result = null;
        Instant startedAt = clock.instant();
        for (int i = 0; i < attempts; i++) {
            long current = store.version(key);
            if (!rules.canIngest(key, current > 0L)) {
                return ingestDenied(key, operation, current);
            }
            if (deletion && expectedVersion == null && !store.exists(key)) {
                return new SubmitOutcome(false, SubmitOutcome.ABSENT, key, -1L, current, -1L, "nothing to delete");
            }
            long expected = expectedVersion != null ? expectedVersion : seedOnce ? 0L : current;
            PendingWrite write = deletion ? PendingWrite.delete(key, expected) : new PendingWrite(key, value, expected);
            try {
                result = store.commit(AclRegistry.INGEST_PRINCIPAL, List.of(write));
            } catch (MeshCorruptionException e) {
                scheduler.halt(e);
                throw e;
            } catch (MeshCapacityException e) {
                ingestRejected.incrementAndGet();
                logger.warn("Ingest of {} rejected: {}", key, e.getMessage());
                return new SubmitOutcome(false, SubmitOutcome.REJECTED, key, -1L, current, -1L, e.getMessage());
            }
            if (result.committed()) {
                break;
            }
        }
        if (!result.committed()) {
            CommitResult.Conflict conflict = result.conflicts().get(0);
            if (!rules.canIngest(key, conflict.actualVersion() > 0L)) {
                return ingestDenied(key, operation, conflict.actualVersion());
            }
            if (conflict.missing()) {
                return new SubmitOutcome(false, SubmitOutcome.ABSENT, key, -1L, conflict.actualVersion(), -1L,
                        "nothing to delete at version " + conflict.actualVersion());
            }
            ingestConflicts.incrementAndGet();
            return new SubmitOutcome(false, SubmitOutcome.CONFLICT, key, -1L, conflict.actualVersion(), -1L,
                    "expected version " + conflict.expectedVersion() + " but found " + conflict.actualVersion());
        }
        long version = result.newVersions().get(key);
        ingestAccepted.incrementAndGet();
        Map<String, JsonNode> after = new LinkedHashMap<>();
        after.put(key, deletion ? null : value == null ? NullNode.getInstance() : value.deepCopy());
        trace.record(new MutationRecord(AclRegistry.INGEST_PRINCIPAL, 0L, 0L, List.of(key), result.before(), after,
                startedAt, clock.instant(), Outcome.SUCCESS, null, result.commitSeq(), deletion ? "deleted" : null));
        return new SubmitOutcome(true, deletion ? SubmitOutcome.DELETED : SubmitOutcome.COMMITTED, key, version, version,
                result.commitSeq(), deletion ? "deleted" : "committed");
    }

    private SubmitOutcome ingestDenied(String key, String operation, long current) {
        ingestRejected.incrementAndGet();
        logger.warn("Ingest {} of {} rejected by ACL", operation, key);
        trace.record(new SecurityEvent(AclRegistry.INGEST_PRINCIPAL, key, operation, 0L, clock.instant()));
        return new SubmitOutcome(false, SubmitOutcome.DENIED, key, -1L, current, -1L,
                "key is not writable by " + AclRegistry.INGEST_PRINCIPAL);
    }

    public Optional<VersionedValue> get(String key) {
        return store.get(key);
    }

    public boolean exists(String key) {
        KeyPatterns.validateKey(key);
        return store.exists(key);
    }

    public List<MeshEntry> entries() {
        return store.entries();
    }

    public long commitSeq() {
        return store.current().commitSeq();
    }

    public List<SqliteMeshBackend.CommitLogRow> commitLog(long fromSeq, int limit) {
        if (backend instanceof SqliteMeshBackend sqlite) {
            return sqlite.commitLog(fromSeq, limit);
        }
        throw new IllegalStateException("Mesh backend " + backend.name() + " keeps no commit log");
    }

    // ---- registration ----

    public String registerUnit(UnitDescriptor descriptor) {
        String id = registry.register(descriptor);
        logger.info("Registered unit {} (priority={}, group={}, policy={})",
                id, descriptor.priority(), descriptor.mutexGroup(), descriptor.executionPolicy());
        trace.record(EngineEvent.of(EngineEvent.REGISTERED, id, clock.instant(), Map.of(
                "priority", descriptor.priority(),
                "mutex_group", String.valueOf(descriptor.mutexGroup()),
                "critical", descriptor.critical()
        )));
        return id;
    }

    public boolean deregisterUnit(String unitId) {
        Optional<RegisteredUnit> removed = registry.deregister(unitId);
        if (removed.isEmpty()) {
            return false;
        }
        scheduler.forget(unitId);
        logger.info("Deregistered unit {}", unitId);
        trace.record(EngineEvent.of(EngineEvent.DEREGISTERED, unitId, clock.instant(), Map.of()));
        return true;
    }

    public boolean setEnabled(String unitId, boolean enabled) {
        boolean changed = registry.setEnabled(unitId, enabled, "manual", clock.millis());
        if (!changed) {
            return false;
        }
        if (!enabled) {
            scheduler.forget(unitId);
        }
        logger.info("Unit {} {}", unitId, enabled ? "enabled" : "disabled");
        trace.record(EngineEvent.of(enabled ? EngineEvent.REENABLED : EngineEvent.DISABLED, unitId, clock.instant(),
                Map.of("automatic", false)));
        return true;
    }

    public List<UnitView> units() {
        Set<String> running = scheduler.runningUnits();
        List<UnitView> out = new ArrayList<>();
        for (RegisteredUnit unit : registry.ordered()) {
            UnitDescriptor d = unit.descriptor();
            out.add(new UnitView(
                    d.id(),
                    d.priority(),
                    d.mutexGroup(),
                    d.executionPolicy().name(),
                    d.critical(),
                    d.temporal(),
                    d.interests(),
                    d.cooldown().toMillis(),
                    d.timeout() == null ? settings.defaultUnitTimeoutMs() : d.timeout().toMillis(),
                    running.contains(d.id()),
                    scheduler.isWaiting(d.id()),
                    unit.counters()
            ));
        }
        return out;
    }

    // ---- reactor loop ----

    public CycleReport runCycle() {
        return scheduler.runCycle();
    }

    public void start() {
        synchronized (loopLock) {
            if (loop != null) {
                return;
            }
            loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "reactormesh-reactor");
                thread.setDaemon(true);
                return thread;
            });
            loop.schedule(this::tick, 0L, TimeUnit.MILLISECONDS);
        }
        logger.info("Reactor loop started (interval={} ms)", settings.cycleIntervalMs());
    }

    public boolean awaitQuiescence(Duration timeout) {
        return scheduler.awaitQuiescence(timeout);
    }

    public boolean halted() {
        return scheduler.halted();
    }

    public void setExternalPressure(double pressure) {
        throttle.setExternalPressure(pressure);
    }

    public void setAcl(AclRegistry next) {
        this.acl = next;
        scheduler.setAcl(next);
    }

    public static List<String> validateAcl(Path manifest) {
        return AclRegistry.validate(AclManifest.load(manifest));
    }

    // ---- observability ----

    public EngineStats stats() {
        Scheduler.SchedulerCounters counters = scheduler.counters();
        List<UnitCounters> units = new ArrayList<>();
        int enabled = 0;
        for (RegisteredUnit unit : registry.ordered()) {
            UnitCounters c = unit.counters();
            units.add(c);
            if (c.enabled()) {
                enabled++;
            }
        }
        return new EngineStats(
                scheduler.halted(),
                scheduler.haltReason(),
                store.current().commitSeq(),
                store.current().size(),
                store.commitCount(),
                store.keysWritten(),
                store.conflictCount(),
                store.commitRetries(),
                store.backendName(),
                store.backendFailures(),
                store.backendBacklog(),
                throttle.pressure(),
                throttle.externalPressure(),
                throttle.mode().name(),
                throttle.currentBudget(),
                throttle.admittedInWindow(),
                throttle.mutationRatePerSecond(),
                throttle.mutationsTotal(),
                counters.cycles(),
                counters.admitted(),
                counters.queued(),
                counters.suppressed(),
                counters.deferred(),
                counters.succeeded(),
                counters.failed(),
                counters.timeouts(),
                counters.quarantined(),
                counters.interrupts(),
                counters.securityEvents(),
                ingestAccepted.get(),
                ingestConflicts.get(),
                ingestRejected.get(),
                registry.size(),
                enabled,
                scheduler.runningUnits().size(),
                scheduler.queueDepths(),
                trace.sinkName(),
                trace.sinkAvailable(),
                trace.written(),
                trace.dropped(),
                trace.sampledOut(),
                trace.buffered(),
                trace.failedWrites(),
                units
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public HealthOutcome health() {
        boolean backendOk = database == null || database.isReachable();
        int backlog = store.backendBacklog();
        boolean sinkOk = trace.sinkAvailable();
        ThrottleMonitor.Mode mode = throttle.mode();
        boolean ok = !scheduler.halted() && backendOk && backlog == 0 && sinkOk;
        return new HealthOutcome(
                ok,
                scheduler.halted(),
                scheduler.haltReason(),
                store.backendName(),
                backendOk,
                backlog,
                sinkOk,
                trace.dropped(),
                throttle.pressure(),
                mode.name(),
                scheduler.queueDepths(),
                clock.instant().toString()
        );
    }

    // ---- maintenance ----

    public MaintenanceOutcome runMaintenance() {
        lastMaintenanceAtMs = clock.millis();
        int archived = 0;
        List<String> archiveFiles = List.of();
        if (traceSink instanceof JsonlTraceSink jsonl) {
            Instant cutoff = clock.instant().minus(Duration.ofHours(settings.traceRetentionHours()));
            JsonlTraceSink.PruneOutcome pruned = jsonl.prune(cutoff);
            archived = pruned.archivedRows();
            archiveFiles = pruned.archiveFiles();
            if (archived > 0) {
                logger.info("Archived {} trace rows older than {}", archived, cutoff);
            }
        }
        int backlog = store.flushBackend();
        return new MaintenanceOutcome(archived, archiveFiles, backlog, clock.instant().toString());
    }

    // ---- settings ----

    public EngineSettings currentSettings() {
        return settings;
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadSettings(true);
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = clock.millis();
        if ((nowMs - lastSettingsCheckMs) < Math.max(0L, minIntervalMs)) {
            return unchanged(nowMs, "skip_interval");
        }
        lastSettingsCheckMs = nowMs;
        return loadSettings(false);
    }

    // Trace buffer and worker queue capacity only change on the next open.
    public void applySettings(EngineSettings next) {
        this.settings = next;
        scheduler.applySettings(next);
        throttle.applySettings(next);
        trace.setSamplingRate(next.traceSamplingRate());
        store.setMaxValueBytes(next.maxValueBytes());
        store.setMaxKeys(next.maxMeshKeys());
    }

    // ---- trace ----

    public List<JsonNode> traceTail(int limit) {
        return jsonlSink().tail(limit);
    }

    public List<JsonNode> traceQuery(String unitId, String kind, int limit) {
        return jsonlSink().query(unitId, kind, limit);
    }

    public JsonlTraceSink.VerifyOutcome verifyTrace() {
        flushTrace(Duration.ofSeconds(5));
        return jsonlSink().verify();
    }

    public JsonlTraceSink.PruneOutcome pruneTrace(Instant cutoff) {
        flushTrace(Duration.ofSeconds(5));
        return jsonlSink().prune(cutoff);
    }

    public boolean flushTrace(Duration timeout) {
        return trace.flush(timeout);
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public VersionStore store() {
        return store;
    }

    @Override
    public void close() {
        synchronized (loopLock) {
            if (loop != null) {
                loop.shutdownNow();
                loop = null;
            }
        }
        scheduler.close();
        try {
            storeSubscription.close();
        } catch (Exception e) {
            logger.warn("Failed to remove mesh subscription", e);
        }
        trace.close(Duration.ofSeconds(5));
        store.close();
        logger.info("Reactor closed");
    }

    private void tick() {
        try {
            if (config != null) {
                maybeReloadSettings(1_000L);
            }
            if (scheduler.halted()) {
                logger.error("Reactor loop stopped: {}", scheduler.haltReason());
                return;
            }
            scheduler.runCycle();
            if (clock.millis() - lastMaintenanceAtMs >= MAINTENANCE_INTERVAL_MS) {
                runMaintenance();
            }
        } catch (MeshCorruptionException e) {
            logger.error("Reactor loop stopped after mesh corruption", e);
            return;
        } catch (RuntimeException e) {
            logger.warn("Reactor cycle failed", e);
        }
        synchronized (loopLock) {
            if (loop != null && !loop.isShutdown()) {
                loop.schedule(this::tick, settings.cycleIntervalMs(), TimeUnit.MILLISECONDS);
            }
        }
    }

    private void ensureRunning() {
        if (scheduler.halted()) {
            throw new IllegalStateException("Reactor halted: " + scheduler.haltReason());
        }
    }

    private JsonlTraceSink jsonlSink() {
        if (traceSink instanceof JsonlTraceSink jsonl) {
            return jsonl;
        }
        throw new IllegalStateException("Trace sink " + traceSink.name() + " does not keep a readable trace file");
    }

    private SettingsReloadOutcome loadSettings(boolean force) {
        long checkedAtMs = clock.millis();
        if (config == null) {
            return unchanged(checkedAtMs, "no_settings_file");
        }
        Path file = config.settingsFile();
        long mtime = fileMtimeMs(file);
        if (!force && mtime == settingsFileMtimeMs) {
            return unchanged(checkedAtMs, "unchanged");
        }
        EngineSettings next;
        try {
            next = EngineSettings.load(file);
        } catch (RuntimeException e) {
            logger.warn("Keeping current settings; reload of {} failed: {}", file, e.getMessage());
            return new SettingsReloadOutcome(false, mtime >= 0L, file.toString(), settings, "invalid: " + e.getMessage(),
                    checkedAtMs, List.of());
        }
        settingsFileMtimeMs = mtime;
        List<String> changedFields = settings.diff(next);
        if (changedFields.isEmpty()) {
            return new SettingsReloadOutcome(false, mtime >= 0L, file.toString(), settings, "no_changes",
                    checkedAtMs, List.of());
        }
        applySettings(next);
        logger.info("Settings reloaded from {}: {}", file, changedFields);
        trace.record(EngineEvent.of(EngineEvent.SETTINGS_RELOADED, null, clock.instant(),
                Map.of("changed_fields", changedFields)));
        return new SettingsReloadOutcome(true, mtime >= 0L, file.toString(), next, "reloaded", checkedAtMs, changedFields);
    }

    private SettingsReloadOutcome unchanged(long checkedAtMs, String message) {
        String source = config == null ? null : config.settingsFile().toString();
        return new SettingsReloadOutcome(false, settingsFileMtimeMs >= 0L, source, settings, message,
                checkedAtMs, List.of());
    }

    private static long fileMtimeMs(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read modification time: " + file, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create directory: " + dir, e);
        }
    }

    private static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize trace signing secret: " + keyFile, e);
        }
    }

    public record SubmitOutcome(
            boolean accepted,
            String status,
            String key,
            long version,
            long actualVersion,
            long commitSeq,
            String message
    ) {
        public static final String COMMITTED = "committed";
        public static final String DELETED = "deleted";
        public static final String CONFLICT = "conflict";
        public static final String DENIED = "denied";
        public static final String ABSENT = "absent";
        public static final String REJECTED = "rejected";
    }

    public record UnitView(
            String id,
            int priority,
            String mutexGroup,
            String executionPolicy,
            boolean critical,
            boolean temporal,
            List<String> interests,
            long cooldownMs,
            long timeoutMs,
            boolean running,
            boolean waiting,
            UnitCounters counters
    ) {
    }

    public record HealthOutcome(
            boolean ok,
            boolean halted,
            String haltReason,
            String backend,
            boolean backendOk,
            int backendBacklog,
            boolean traceSinkAvailable,
            long traceDropped,
            double pressure,
            String throttleMode,
            Map<String, Integer> mutexQueueDepth,
            String checkedAt
    ) {
    }

    public record MaintenanceOutcome(
            int traceRowsArchived,
            List<String> archiveFiles,
            int backendBacklog,
            String ranAt
    ) {
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            EngineSettings settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }
}
