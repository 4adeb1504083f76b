package io.reactormesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One committed key of the mesh. Owned by the version store; units only ever see
 * copies through a {@link Snapshot}. A deleted key stays behind as a tombstone so its
 * version keeps counting up when the key is written again.
 */
public record MeshEntry(
        String key,
        JsonNode value,
        long version,
        String lastWrittenBy,
        Instant writtenAt,
        boolean deleted
) {
    public MeshEntry {
        value = value == null || deleted ? null : value.deepCopy();
    }

    public MeshEntry(String key, JsonNode value, long version, String lastWrittenBy, Instant writtenAt) {
        this(key, value, version, lastWrittenBy, writtenAt, false);
    }

    public static MeshEntry tombstone(String key, long version, String deletedBy, Instant deletedAt) {
        return new MeshEntry(key, null, version, deletedBy, deletedAt, true);
    }

    public boolean exists() {
        return !deleted;
    }

    @Override
    public JsonNode value() {
        return value == null ? null : value.deepCopy();
    }

    public VersionedValue versioned() {
        return deleted ? VersionedValue.tombstone(version) : new VersionedValue(value, version);
    }
}
