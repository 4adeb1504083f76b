package io.reactormesh.store;

@FunctionalInterface
public interface MeshChangeListener {
    void onCommit(CommitBatch batch);
}
