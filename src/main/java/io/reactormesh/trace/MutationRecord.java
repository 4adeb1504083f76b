package io.reactormesh.trace;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.model.FailureReason;
import io.reactormesh.model.Outcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one execution attempt. {@code before} and {@code after} hold the values of
 * {@code keysChanged} around the commit; both are empty when nothing was committed.
 */
public record MutationRecord(
        String unitId,
        long snapshotId,
        long cycleId,
        List<String> keysChanged,
        Map<String, JsonNode> before,
        Map<String, JsonNode> after,
        Instant startedAt,
        Instant finishedAt,
        Outcome outcome,
        FailureReason failureReason,
        long commitSeq,
        String detail
) implements TraceRecord {
    public MutationRecord {
        keysChanged = keysChanged == null ? List.of() : List.copyOf(keysChanged);
        before = before == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(before));
        after = after == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(after));
    }

    public static MutationRecord withoutCommit(
            String unitId,
            long snapshotId,
            long cycleId,
            Instant startedAt,
            Instant finishedAt,
            Outcome outcome,
            FailureReason failureReason,
            String detail
    ) {
        return new MutationRecord(unitId, snapshotId, cycleId, List.of(), Map.of(), Map.of(),
                startedAt, finishedAt, outcome, failureReason, -1L, detail);
    }

    @Override
    public String kind() {
        return "mutation";
    }

    @Override
    public Instant at() {
        return finishedAt;
    }
}
