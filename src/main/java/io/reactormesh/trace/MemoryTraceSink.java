package io.reactormesh.trace;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps records in memory. {@link #setAvailable(boolean)} simulates an outage.
 */
public final class MemoryTraceSink implements TraceSink {
    private final List<TraceRecord> records = new ArrayList<>();
    private volatile boolean available = true;

    @Override
    public synchronized void write(List<TraceRecord> batch) throws TraceSinkUnavailableException {
        if (!available) {
            throw new TraceSinkUnavailableException("memory trace sink marked unavailable");
        }
        records.addAll(batch);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public synchronized List<TraceRecord> records() {
        return List.copyOf(records);
    }

    public synchronized <T extends TraceRecord> List<T> records(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (TraceRecord record : records) {
            if (type.isInstance(record)) {
                out.add(type.cast(record));
            }
        }
        return out;
    }

    @Override
    public String name() {
        return "memory";
    }
}
