package io.reactormesh.store;

public final class ValueTooLargeException extends IllegalArgumentException {
    private final String key;
    private final int sizeBytes;

    public ValueTooLargeException(String key, int sizeBytes, int maxBytes) {
        super("value for " + key + " is " + sizeBytes + " bytes, limit " + maxBytes);
        this.key = key;
        this.sizeBytes = sizeBytes;
    }

    public String key() {
        return key;
    }

    public int sizeBytes() {
        return sizeBytes;
    }
}
