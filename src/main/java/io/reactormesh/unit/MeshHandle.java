package io.reactormesh.unit;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.acl.AccessDeniedException;
import io.reactormesh.acl.AclRegistry;
import io.reactormesh.model.Snapshot;
import io.reactormesh.model.VersionedValue;
import io.reactormesh.store.KeyPatterns;
import io.reactormesh.store.MeshCapacityException;
import io.reactormesh.store.PendingWrite;
import io.reactormesh.store.VersionStore;
import io.reactormesh.util.Jsons;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The view a unit's {@code act} gets of the mesh. Reads of declared interests come from
 * the cycle snapshot (other keys are read once from the live store and pinned); writes
 * and deletes are buffered and only committed, all together, after {@code act} returns
 * normally.
 */
public final class MeshHandle {
    private final String unitId;
    private final long cycleId;
    private final Snapshot snapshot;
    private final List<String> interests;
    private final VersionStore store;
    private final AclRegistry acl;
    private final int maxWrites;
    private final CancellationToken cancellation;
    private final Consumer<AccessDeniedException> deniedObserver;
    private final Map<String, VersionedValue> pinned;
    private final Map<String, PendingWrite> writes;
    private volatile boolean sealed;

    public MeshHandle(
            String unitId,
            long cycleId,
            Snapshot snapshot,
            List<String> interests,
            VersionStore store,
            AclRegistry acl,
            int maxWrites,
            CancellationToken cancellation,
            Consumer<AccessDeniedException> deniedObserver
    ) {
        this.unitId = unitId;
        this.cycleId = cycleId;
        this.snapshot = snapshot;
        this.interests = interests == null ? List.of() : List.copyOf(interests);
        this.store = store;
        this.acl = acl;
        this.maxWrites = Math.max(1, maxWrites);
        this.cancellation = cancellation;
        this.deniedObserver = deniedObserver;
        this.pinned = new HashMap<>();
        this.writes = new LinkedHashMap<>();
    }

    public String unitId() {
        return unitId;
    }

    public long cycleId() {
        return cycleId;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public synchronized Optional<JsonNode> read(String key) {
        KeyPatterns.validateKey(key);
        if (!acl.canRead(unitId, key)) {
            throw denied(key, "read");
        }
        PendingWrite pending = writes.get(key);
        if (pending != null) {
            return Optional.ofNullable(pending.value());
        }
        VersionedValue observed = observe(key);
        return observed == null || observed.deleted() ? Optional.empty() : Optional.ofNullable(observed.value());
    }

    /**
     * Whether {@code key} holds a value as this execution sees it, buffered writes and
     * deletes included.
     */
    public synchronized boolean exists(String key) {
        KeyPatterns.validateKey(key);
        if (!acl.canRead(unitId, key)) {
            throw denied(key, "read");
        }
        PendingWrite pending = writes.get(key);
        if (pending != null) {
            return !pending.deletion();
        }
        VersionedValue observed = observe(key);
        return observed != null && !observed.deleted();
    }

    /**
     * Version this execution observed for {@code key}, 0 when never written.
     */
    public synchronized long version(String key) {
        KeyPatterns.validateKey(key);
        VersionedValue observed = observe(key);
        return observed == null ? 0L : observed.version();
    }

    /**
     * Buffers a write guarded by the version this execution observed for the key.
     */
    public void write(String key, Object value) {
        writeExpecting(key, value, version(key));
    }

    public synchronized void writeExpecting(String key, Object value, long expectedVersion) {
        checkWritable(key, "write");
        buffer(new PendingWrite(key, Jsons.toNode(value), expectedVersion));
    }

    /**
     * Buffers a delete of {@code key}. Returns false, buffering nothing, when the key
     * holds no value as this execution sees it.
     */
    public synchronized boolean delete(String key) {
        checkWritable(key, "delete");
        PendingWrite pending = writes.get(key);
        if (pending != null && pending.deletion()) {
            return false;
        }
        VersionedValue observed = observe(key);
        boolean committed = observed != null && !observed.deleted();
        if (!committed) {
            if (pending != null) {
                writes.remove(key);
                return true;
            }
            return false;
        }
        buffer(PendingWrite.delete(key, observed.version()));
        return true;
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancelled();
    }

    /**
     * Cooperative cancellation point.
     *
     * @throws ExecutionCancelledException once the engine asked this execution to stop
     */
    public void checkpoint() {
        if (cancellation.isCancelled()) {
            throw new ExecutionCancelledException(cancellation.reason());
        }
    }

    public void onCancel(Runnable callback) {
        cancellation.onCancel(callback);
    }

    /**
     * Stops accepting writes and returns what was buffered, in write order.
     */
    public synchronized List<PendingWrite> seal() {
        sealed = true;
        return new ArrayList<>(writes.values());
    }

    private void checkWritable(String key, String operation) {
        if (sealed) {
            throw new IllegalStateException("mesh handle of " + unitId + " is closed");
        }
        KeyPatterns.validateKey(key);
        if (!acl.canWrite(unitId, key)) {
            throw denied(key, operation);
        }
    }

    private void buffer(PendingWrite write) {
        if (!writes.containsKey(write.key()) && writes.size() >= maxWrites) {
            throw new MeshCapacityException(unitId + " may write at most " + maxWrites + " keys per execution", maxWrites);
        }
        writes.put(write.key(), write);
    }

    private VersionedValue observe(String key) {
        if (snapshot.observed(key).isPresent() || KeyPatterns.matchesAny(interests, key)) {
            return snapshot.observed(key).orElse(null);
        }
        if (pinned.containsKey(key)) {
            return pinned.get(key);
        }
        VersionedValue live = store.observed(key).orElse(null);
        pinned.put(key, live);
        return live;
    }

    private AccessDeniedException denied(String key, String operation) {
        AccessDeniedException e = new AccessDeniedException(unitId, key, operation);
        if (deniedObserver != null) {
            deniedObserver.accept(e);
        }
        return e;
    }
}
