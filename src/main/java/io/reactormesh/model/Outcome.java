package io.reactormesh.model;

public enum Outcome {
    SUCCESS,
    FAILED,
    SUPPRESSED,
    QUARANTINED,
    DEFERRED
}
