package io.reactormesh.model;

public enum FailureReason {
    VERSION_CONFLICT,
    ACCESS_DENIED,
    TIMEOUT,
    CANCELLED,
    VALUE_TOO_LARGE,
    CAPACITY_EXCEEDED,
    ERROR
}
