package io.reactormesh.model;

public enum ExecutionPolicy {
    QUEUE,
    ABORT_LOWER,
    INTERRUPT;

    public static ExecutionPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return QUEUE;
        }
        String normalized = raw.trim().replace('-', '_');
        for (ExecutionPolicy value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown execution policy: " + raw);
    }
}
