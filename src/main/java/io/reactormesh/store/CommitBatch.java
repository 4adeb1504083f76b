package io.reactormesh.store;

import io.reactormesh.model.MeshEntry;

import java.time.Instant;
import java.util.List;

/**
 * Entries published together by one commit, in the order they were written.
 */
public record CommitBatch(long commitSeq, String writerId, Instant committedAt, List<MeshEntry> entries) {
    public List<String> keys() {
        return entries.stream().map(MeshEntry::key).toList();
    }
}
