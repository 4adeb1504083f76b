package io.reactormesh.trace;

public final class TraceSinkUnavailableException extends Exception {
    public TraceSinkUnavailableException(String message) {
        super(message);
    }

    public TraceSinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
