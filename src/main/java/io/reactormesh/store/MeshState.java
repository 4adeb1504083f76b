package io.reactormesh.store;

import io.reactormesh.model.MeshEntry;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable root of the version store. A new root is published per commit, so a
 * reader holding one root sees every multi-key commit either fully or not at all.
 */
public final class MeshState {
    static final MeshState EMPTY = new MeshState(Map.of(), 0L);

    private final Map<String, MeshEntry> entries;
    private final long commitSeq;
    private final int liveKeys;

    MeshState(Map<String, MeshEntry> entries, long commitSeq) {
        this.entries = Collections.unmodifiableMap(entries);
        this.commitSeq = commitSeq;
        int count = 0;
        for (MeshEntry entry : entries.values()) {
            if (entry.exists()) {
                count++;
            }
        }
        this.liveKeys = count;
    }

    public long commitSeq() {
        return commitSeq;
    }

    /**
     * The stored entry for {@code key}, tombstones included.
     */
    public Optional<MeshEntry> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean exists(String key) {
        MeshEntry entry = entries.get(key);
        return entry != null && entry.exists();
    }

    public long version(String key) {
        MeshEntry entry = entries.get(key);
        return entry == null ? 0L : entry.version();
    }

    /**
     * Keys that currently hold a value.
     */
    public int size() {
        return liveKeys;
    }

    public int tombstones() {
        return entries.size() - liveKeys;
    }

    Map<String, MeshEntry> entries() {
        return entries;
    }
}
