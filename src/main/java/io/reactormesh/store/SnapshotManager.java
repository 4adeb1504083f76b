package io.reactormesh.store;

import io.reactormesh.model.MeshEntry;
import io.reactormesh.model.Snapshot;
import io.reactormesh.model.VersionedValue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds immutable snapshots from a single {@link MeshState} root. Because the root
 * only ever changes by whole commits, a snapshot never mixes halves of one.
 */
public final class SnapshotManager {
    private final VersionStore store;
    private final Clock clock;
    private final AtomicLong nextId;

    public SnapshotManager(VersionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.nextId = new AtomicLong(0L);
    }

    public Snapshot capture(Collection<String> interests) {
        return capture(store.current(), interests);
    }

    public Snapshot capture(MeshState state, Collection<String> interests) {
        Map<String, VersionedValue> selected = new TreeMap<>();
        List<String> patterns = new ArrayList<>();
        if (interests != null) {
            for (String interest : interests) {
                if (interest == null || interest.isBlank()) {
                    continue;
                }
                if (interest.endsWith("*")) {
                    patterns.add(interest);
                } else {
                    state.entry(interest).ifPresent(e -> selected.put(e.key(), e.versioned()));
                }
            }
        }
        if (!patterns.isEmpty()) {
            for (MeshEntry entry : state.entries().values()) {
                if (!selected.containsKey(entry.key()) && KeyPatterns.matchesAny(patterns, entry.key())) {
                    selected.put(entry.key(), entry.versioned());
                }
            }
        }
        return new Snapshot(nextId.incrementAndGet(), clock.instant(), state.commitSeq(), selected);
    }

    public long lastSnapshotId() {
        return nextId.get();
    }
}
