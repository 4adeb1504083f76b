package io.reactormesh.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One buffered write. A deletion carries no value and leaves a tombstone at the next
 * version.
 */
public record PendingWrite(String key, JsonNode value, long expectedVersion, boolean deletion) {
    public PendingWrite {
        value = value == null || deletion ? null : value.deepCopy();
    }

    public PendingWrite(String key, JsonNode value, long expectedVersion) {
        this(key, value, expectedVersion, false);
    }

    public static PendingWrite delete(String key, long expectedVersion) {
        return new PendingWrite(key, null, expectedVersion, true);
    }
}
