package io.reactormesh.acl;

public final class AccessDeniedException extends RuntimeException {
    private final String unitId;
    private final String key;
    private final String operation;

    public AccessDeniedException(String unitId, String key, String operation) {
        super(unitId + " may not " + operation + " " + key);
        this.unitId = unitId;
        this.key = key;
        this.operation = operation;
    }

    public String unitId() {
        return unitId;
    }

    public String key() {
        return key;
    }

    public String operation() {
        return operation;
    }
}
