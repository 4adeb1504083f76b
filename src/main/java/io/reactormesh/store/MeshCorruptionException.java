package io.reactormesh.store;

/**
 * Thrown when a version-store invariant no longer holds, e.g. a version went backward.
 * Never recovered from inside the engine.
 */
public final class MeshCorruptionException extends RuntimeException {
    public MeshCorruptionException(String message) {
        super(message);
    }
}
