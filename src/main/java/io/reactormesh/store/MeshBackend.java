package io.reactormesh.store;

import io.reactormesh.model.MeshEntry;

import java.util.List;

/**
 * Narrow persistence seam behind the version store. The in-memory store is
 * authoritative; a backend receives every committed batch and hands back the last
 * known state on startup.
 */
public interface MeshBackend extends AutoCloseable {
    StoredMesh loadAll();

    void append(CommitBatch batch);

    String name();

    @Override
    default void close() {
    }

    static MeshBackend none() {
        return new MeshBackend() {
            @Override
            public StoredMesh loadAll() {
                return new StoredMesh(List.of(), 0L);
            }

            @Override
            public void append(CommitBatch batch) {
            }

            @Override
            public String name() {
                return "memory";
            }
        };
    }

    record StoredMesh(List<MeshEntry> entries, long lastCommitSeq) {
    }
}
