package io.reactormesh.store;

/**
 * A write would take the mesh, or one execution's write set, past its key limit.
 */
public final class MeshCapacityException extends IllegalStateException {
    private final int limit;

    public MeshCapacityException(String message, int limit) {
        super(message);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
