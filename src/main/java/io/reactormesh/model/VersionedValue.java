package io.reactormesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A value paired with the version it was committed at. The node is a private copy;
 * {@link #value()} hands out a fresh copy on every call.
 */
public final class VersionedValue {
    private final JsonNode value;
    private final long version;
    private final boolean deleted;

    public VersionedValue(JsonNode value, long version) {
        this(value, version, false);
    }

    private VersionedValue(JsonNode value, long version, boolean deleted) {
        this.value = value == null ? null : value.deepCopy();
        this.version = version;
        this.deleted = deleted;
    }

    /**
     * The version a deleted key was removed at.
     */
    public static VersionedValue tombstone(long version) {
        return new VersionedValue(null, version, true);
    }

    public JsonNode value() {
        return value == null ? null : value.deepCopy();
    }

    public long version() {
        return version;
    }

    public boolean deleted() {
        return deleted;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VersionedValue that)) {
            return false;
        }
        return version == that.version && deleted == that.deleted && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, version, deleted);
    }

    @Override
    public String toString() {
        return deleted
                ? "VersionedValue{version=" + version + ", deleted}"
                : "VersionedValue{version=" + version + ", value=" + value + "}";
    }
}
