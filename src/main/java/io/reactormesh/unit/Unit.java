package io.reactormesh.unit;

import io.reactormesh.model.Snapshot;

/**
 * A reactive handler. {@link #trigger(Snapshot)} must be side-effect free; it may be
 * evaluated many times against the same snapshot. {@link #act(MeshHandle)} runs on a
 * worker thread and should poll {@link MeshHandle#checkpoint()} during long work.
 */
public interface Unit {
    boolean trigger(Snapshot snapshot);

    void act(MeshHandle mesh) throws Exception;
}
