package io.reactormesh.unit;

public final class ExecutionCancelledException extends RuntimeException {
    public ExecutionCancelledException(String reason) {
        super("execution cancelled: " + reason);
    }
}
