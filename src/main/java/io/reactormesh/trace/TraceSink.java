package io.reactormesh.trace;

import java.util.List;

/**
 * Durable destination of trace records. A batch is either written completely or the
 * call throws and the caller keeps it for a retry.
 */
public interface TraceSink extends AutoCloseable {
    void write(List<TraceRecord> batch) throws TraceSinkUnavailableException;

    String name();

    @Override
    default void close() {
    }
}
