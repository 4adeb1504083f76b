package io.reactormesh.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.reactormesh.model.MeshEntry;
import io.reactormesh.model.VersionedValue;
import io.reactormesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Versioned key/value map behind a single atomically swapped root.
 *
 * <p>{@link #commit(String, List)} is the only mutation primitive. It validates every
 * expected version against the current root and publishes a new root with one
 * {@code compareAndSet}; readers never lock. When the swap loses a race the commit is
 * re-validated against the newer root, so a concurrent write to one of its own keys
 * surfaces as a conflict while unrelated writes only cost a retry.
 *
 * <p>Deleting a key leaves a tombstone at the next version, so a later write to the same
 * key continues the version sequence instead of restarting it.
 */
public final class VersionStore {
    private static final Logger logger = LoggerFactory.getLogger(VersionStore.class);

    private final AtomicReference<MeshState> root;
    private final MeshBackend backend;
    private final Clock clock;
    private final AtomicLong highestCommitSeq;
    private final AtomicLong commitCount;
    private final AtomicLong keysWritten;
    private final AtomicLong conflictCount;
    private final AtomicLong commitRetries;
    private final AtomicLong backendFailures;
    private final Object backendLock;
    private final ArrayDeque<CommitBatch> backendBacklog;
    private final List<Subscription> subscriptions;
    private volatile int maxValueBytes;
    private volatile int maxKeys;

    public VersionStore(MeshBackend backend, Clock clock, int maxValueBytes) {
        this(backend, clock, maxValueBytes, Integer.MAX_VALUE);
    }

    public VersionStore(MeshBackend backend, Clock clock, int maxValueBytes, int maxKeys) {
        this.root = new AtomicReference<>(MeshState.EMPTY);
        this.backend = backend == null ? MeshBackend.none() : backend;
        this.clock = clock;
        this.highestCommitSeq = new AtomicLong(0L);
        this.commitCount = new AtomicLong(0L);
        this.keysWritten = new AtomicLong(0L);
        this.conflictCount = new AtomicLong(0L);
        this.commitRetries = new AtomicLong(0L);
        this.backendFailures = new AtomicLong(0L);
        this.backendLock = new Object();
        this.backendBacklog = new ArrayDeque<>();
        this.subscriptions = new CopyOnWriteArrayList<>();
        this.maxValueBytes = Math.max(64, maxValueBytes);
        this.maxKeys = Math.max(1, maxKeys);
    }

    public MeshState current() {
        long highest = highestCommitSeq.get();
        MeshState state = root.get();
        if (state.commitSeq() < highest) {
            throw new MeshCorruptionException(
                    "commit sequence went backward: " + state.commitSeq() + " < " + highest);
        }
        return state;
    }

    public Optional<VersionedValue> get(String key) {
        return current().entry(key).filter(MeshEntry::exists).map(MeshEntry::versioned);
    }

    /**
     * Like {@link #get(String)}, but a deleted key comes back as its tombstone.
     */
    public Optional<VersionedValue> observed(String key) {
        return current().entry(key).map(MeshEntry::versioned);
    }

    public Optional<MeshEntry> entry(String key) {
        return current().entry(key).filter(MeshEntry::exists);
    }

    public boolean exists(String key) {
        return current().exists(key);
    }

    public long version(String key) {
        return current().version(key);
    }

    public List<MeshEntry> entries() {
        List<MeshEntry> out = new ArrayList<>();
        for (MeshEntry entry : current().entries().values()) {
            if (entry.exists()) {
                out.add(entry);
            }
        }
        out.sort((a, b) -> a.key().compareTo(b.key()));
        return out;
    }

    public CasResult compareAndSet(String writerId, String key, long expectedVersion, JsonNode value) {
        CommitResult result = commit(writerId, List.of(new PendingWrite(key, value, expectedVersion)));
        return CasResult.from(result, key, expectedVersion);
    }

    public CasResult delete(String writerId, String key, long expectedVersion) {
        CommitResult result = commit(writerId, List.of(PendingWrite.delete(key, expectedVersion)));
        return CasResult.from(result, key, expectedVersion);
    }

    /**
     * Applies every write or none of them. Throws {@link IllegalArgumentException} for
     * malformed input (including {@link ValueTooLargeException}) and
     * {@link MeshCapacityException} when the commit would leave more live keys than the
     * limit; version mismatches are reported through the result, never thrown.
     */
    public CommitResult commit(String writerId, List<PendingWrite> writes) {
        if (writerId == null || writerId.isBlank()) {
            throw new IllegalArgumentException("writer id cannot be empty");
        }
        validate(writes);
        while (true) {
            MeshState base = current();
            List<CommitResult.Conflict> conflicts = new ArrayList<>();
            int addedKeys = 0;
            for (PendingWrite write : writes) {
                long actual = base.version(write.key());
                boolean live = base.exists(write.key());
                if (actual != write.expectedVersion()) {
                    conflicts.add(new CommitResult.Conflict(write.key(), write.expectedVersion(), actual));
                } else if (write.deletion() && !live) {
                    conflicts.add(new CommitResult.Conflict(write.key(), write.expectedVersion(), actual, true));
                } else if (write.deletion()) {
                    addedKeys--;
                } else if (!live) {
                    addedKeys++;
                }
            }
            if (!conflicts.isEmpty()) {
                conflictCount.incrementAndGet();
                return CommitResult.conflicted(base.commitSeq(), conflicts);
            }
            int limit = maxKeys;
            if (addedKeys > 0 && base.size() + addedKeys > limit) {
                throw new MeshCapacityException("mesh holds " + base.size() + " keys; writing "
                        + addedKeys + " new keys would pass the limit of " + limit, limit);
            }

            Instant now = clock.instant();
            long seq = base.commitSeq() + 1L;
            Map<String, MeshEntry> next = new HashMap<>(base.entries());
            Map<String, Long> newVersions = new LinkedHashMap<>();
            Map<String, JsonNode> before = new LinkedHashMap<>();
            List<MeshEntry> written = new ArrayList<>(writes.size());
            for (PendingWrite write : writes) {
                MeshEntry previous = base.entries().get(write.key());
                long previousVersion = previous == null ? 0L : previous.version();
                MeshEntry entry;
                if (write.deletion()) {
                    entry = MeshEntry.tombstone(write.key(), previousVersion + 1L, writerId, now);
                } else {
                    JsonNode value = write.value() == null ? NullNode.getInstance() : write.value();
                    entry = new MeshEntry(write.key(), value, previousVersion + 1L, writerId, now);
                }
                next.put(write.key(), entry);
                newVersions.put(write.key(), entry.version());
                before.put(write.key(), previous == null ? null : previous.value());
                written.add(entry);
            }
            if (!root.compareAndSet(base, new MeshState(next, seq))) {
                commitRetries.incrementAndGet();
                continue;
            }
            highestCommitSeq.accumulateAndGet(seq, Math::max);
            commitCount.incrementAndGet();
            keysWritten.addAndGet(written.size());

            CommitBatch batch = new CommitBatch(seq, writerId, now, List.copyOf(written));
            appendToBackend(batch);
            notifySubscribers(batch);
            return CommitResult.committed(seq, newVersions, Collections.unmodifiableMap(before));
        }
    }

    /**
     * Loads persisted entries into an empty or partially filled store. A version that is
     * not positive, or lower than what the store already holds, means the persisted
     * state cannot be trusted.
     */
    public void restore(MeshBackend.StoredMesh stored) {
        if (stored == null) {
            return;
        }
        MeshState base = current();
        if (stored.lastCommitSeq() < 0L) {
            throw new MeshCorruptionException("negative commit sequence in backend: " + stored.lastCommitSeq());
        }
        Map<String, MeshEntry> next = new HashMap<>(base.entries());
        for (MeshEntry entry : stored.entries()) {
            KeyPatterns.validateKey(entry.key());
            if (entry.version() <= 0L) {
                throw new MeshCorruptionException("non-positive version " + entry.version() + " for key " + entry.key());
            }
            MeshEntry existing = next.get(entry.key());
            if (existing != null && entry.version() < existing.version()) {
                throw new MeshCorruptionException("version went backward for key " + entry.key()
                        + ": " + entry.version() + " < " + existing.version());
            }
            next.put(entry.key(), entry);
        }
        long seq = Math.max(base.commitSeq(), stored.lastCommitSeq());
        if (!root.compareAndSet(base, new MeshState(next, seq))) {
            throw new IllegalStateException("restore raced with a concurrent commit");
        }
        highestCommitSeq.accumulateAndGet(seq, Math::max);
        logger.info("Restored {} mesh entries from backend {} (commitSeq={})",
                stored.entries().size(), backend.name(), seq);
    }

    public void restoreFromBackend() {
        restore(backend.loadAll());
    }

    /**
     * Registers a listener for commits touching keys that match {@code pattern}.
     * Closing the returned handle removes it.
     */
    public AutoCloseable subscribe(String pattern, MeshChangeListener listener) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("subscription pattern cannot be empty");
        }
        Subscription subscription = new Subscription(pattern, listener);
        subscriptions.add(subscription);
        return () -> subscriptions.remove(subscription);
    }

    /**
     * Retries batches the backend previously refused. Returns the number still pending.
     */
    public int flushBackend() {
        synchronized (backendLock) {
            drainBacklogLocked();
            return backendBacklog.size();
        }
    }

    public int backendBacklog() {
        synchronized (backendLock) {
            return backendBacklog.size();
        }
    }

    public void setMaxValueBytes(int maxValueBytes) {
        this.maxValueBytes = Math.max(64, maxValueBytes);
    }

    public int maxValueBytes() {
        return maxValueBytes;
    }

    public void setMaxKeys(int maxKeys) {
        this.maxKeys = Math.max(1, maxKeys);
    }

    public int maxKeys() {
        return maxKeys;
    }

    public String backendName() {
        return backend.name();
    }

    public long commitCount() {
        return commitCount.get();
    }

    public long keysWritten() {
        return keysWritten.get();
    }

    public long conflictCount() {
        return conflictCount.get();
    }

    public long commitRetries() {
        return commitRetries.get();
    }

    public long backendFailures() {
        return backendFailures.get();
    }

    public void close() {
        int pending = flushBackend();
        if (pending > 0) {
            logger.warn("Closing mesh backend {} with {} unpersisted commit batches", backend.name(), pending);
        }
        backend.close();
    }

    private void validate(List<PendingWrite> writes) {
        if (writes == null || writes.isEmpty()) {
            throw new IllegalArgumentException("commit requires at least one write");
        }
        Set<String> seen = new HashSet<>();
        for (PendingWrite write : writes) {
            KeyPatterns.validateKey(write.key());
            if (!seen.add(write.key())) {
                throw new IllegalArgumentException("duplicate key in commit: " + write.key());
            }
            if (write.expectedVersion() < 0L) {
                throw new IllegalArgumentException("expected version cannot be negative: " + write.key());
            }
            int size = Jsons.serializedSize(write.value());
            if (size > maxValueBytes) {
                throw new ValueTooLargeException(write.key(), size, maxValueBytes);
            }
        }
    }

    private void appendToBackend(CommitBatch batch) {
        synchronized (backendLock) {
            backendBacklog.addLast(batch);
            drainBacklogLocked();
        }
    }

    private void drainBacklogLocked() {
        while (!backendBacklog.isEmpty()) {
            CommitBatch head = backendBacklog.peekFirst();
            try {
                backend.append(head);
                backendBacklog.pollFirst();
            } catch (RuntimeException e) {
                backendFailures.incrementAndGet();
                logger.warn("Mesh backend {} refused commit {} ({} pending): {}",
                        backend.name(), head.commitSeq(), backendBacklog.size(), e.getMessage());
                return;
            }
        }
    }

    private void notifySubscribers(CommitBatch batch) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.matches(batch)) {
                continue;
            }
            try {
                subscription.listener().onCommit(batch);
            } catch (RuntimeException e) {
                logger.warn("Mesh change listener for {} failed on commit {}", subscription.pattern(), batch.commitSeq(), e);
            }
        }
    }

    private record Subscription(String pattern, MeshChangeListener listener) {
        boolean matches(CommitBatch batch) {
            for (MeshEntry entry : batch.entries()) {
                if (KeyPatterns.matches(pattern, entry.key())) {
                    return true;
                }
            }
            return false;
        }
    }
}
