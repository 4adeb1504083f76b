package io.reactormesh.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record CommitResult(
        boolean committed,
        long commitSeq,
        Map<String, Long> newVersions,
        Map<String, JsonNode> before,
        List<Conflict> conflicts
) {
    static CommitResult committed(long commitSeq, Map<String, Long> newVersions, Map<String, JsonNode> before) {
        return new CommitResult(true, commitSeq, Map.copyOf(newVersions), before, List.of());
    }

    static CommitResult conflicted(long commitSeq, List<Conflict> conflicts) {
        return new CommitResult(false, commitSeq, Map.of(), Map.of(), List.copyOf(conflicts));
    }

    /**
     * {@code missing} marks a deletion of a key that holds no value at the expected
     * version.
     */
    public record Conflict(String key, long expectedVersion, long actualVersion, boolean missing) {
        public Conflict(String key, long expectedVersion, long actualVersion) {
            this(key, expectedVersion, actualVersion, false);
        }
    }
}
