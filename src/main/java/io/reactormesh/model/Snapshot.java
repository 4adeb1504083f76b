package io.reactormesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable point-in-time view of a key subset. Every read of the same key returns
 * the same (value, version); nothing a caller does to a returned value leaks back.
 * Deleted keys are absent from every read except {@link #version(String)} and
 * {@link #observed(String)}.
 */
public final class Snapshot {
    private final long id;
    private final Instant capturedAt;
    private final long commitSeq;
    private final Map<String, VersionedValue> entries;
    private final Map<String, VersionedValue> live;

    public Snapshot(long id, Instant capturedAt, long commitSeq, Map<String, VersionedValue> entries) {
        this.id = id;
        this.capturedAt = capturedAt;
        this.commitSeq = commitSeq;
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
        Map<String, VersionedValue> present = new TreeMap<>();
        this.entries.forEach((key, value) -> {
            if (!value.deleted()) {
                present.put(key, value);
            }
        });
        this.live = Collections.unmodifiableMap(present);
    }

    public long id() {
        return id;
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    public long commitSeq() {
        return commitSeq;
    }

    public Optional<VersionedValue> get(String key) {
        return Optional.ofNullable(live.get(key));
    }

    /**
     * The captured entry for {@code key}, tombstones included.
     */
    public Optional<VersionedValue> observed(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Optional<JsonNode> value(String key) {
        VersionedValue v = live.get(key);
        return v == null ? Optional.empty() : Optional.ofNullable(v.value());
    }

    /**
     * Version of {@code key} as captured, 0 when the key was never written. A deleted
     * key reports the version of its tombstone.
     */
    public long version(String key) {
        VersionedValue v = entries.get(key);
        return v == null ? 0L : v.version();
    }

    public boolean contains(String key) {
        return live.containsKey(key);
    }

    public Set<String> keys() {
        return live.keySet();
    }

    public int size() {
        return live.size();
    }
}
