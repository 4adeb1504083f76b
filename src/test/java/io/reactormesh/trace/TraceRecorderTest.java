package io.reactormesh.trace;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class TraceRecorderTest {
    private static final Instant AT = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void fullBufferDropsAndCounts() {
        MemoryTraceSink sink = new MemoryTraceSink();
        TraceRecorder recorder = new TraceRecorder(sink, 2, 1.0d);
        try {
            for (int i = 0; i < 5; i++) {
                recorder.record(event("u" + i));
            }

            Assertions.assertEquals(3L, recorder.dropped());
            Assertions.assertEquals(2, recorder.buffered());
            Assertions.assertEquals(0L, recorder.written());
        } finally {
            recorder.close(Duration.ofMillis(100));
        }
    }

    @Test
    void recordsHeldDuringOutageReachTheSinkAfterRecovery() throws Exception {
        MemoryTraceSink sink = new MemoryTraceSink();
        sink.setAvailable(false);
        TraceRecorder recorder = new TraceRecorder(sink, 16, 1.0d);
        recorder.start();
        try {
            recorder.record(event("a"));
            recorder.record(event("b"));
            recorder.record(new SecurityEvent("c", "locked.key", "write", 1L, AT));

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (recorder.failedWrites() == 0L && System.nanoTime() < deadline) {
                Thread.sleep(5L);
            }
            Assertions.assertTrue(recorder.failedWrites() >= 1L);
            Assertions.assertFalse(recorder.sinkAvailable());
            Assertions.assertFalse(recorder.flush(Duration.ofMillis(50)));
            Assertions.assertEquals(3, recorder.buffered());

            sink.setAvailable(true);
            Assertions.assertTrue(recorder.flush(Duration.ofSeconds(10)));
            Assertions.assertTrue(recorder.sinkAvailable());
            Assertions.assertEquals(3, sink.records().size());
            Assertions.assertEquals(0L, recorder.dropped());
            Assertions.assertEquals(3L, recorder.written());
        } finally {
            recorder.close(Duration.ofSeconds(2));
        }
    }

    @Test
    void samplingOnlyThinsOutEvaluations() {
        MemoryTraceSink sink = new MemoryTraceSink();
        TraceRecorder recorder = new TraceRecorder(sink, 16, 0.0d);
        recorder.start();
        try {
            recorder.record(new EvaluationRecord("u1", 1L, 1L, AT, false, EvaluationRecord.NOT_TRIGGERED));
            recorder.record(new EvaluationRecord("u1", 2L, 2L, AT, false, EvaluationRecord.NOT_TRIGGERED));
            recorder.record(event("u1"));

            Assertions.assertTrue(recorder.flush(Duration.ofSeconds(5)));
            Assertions.assertEquals(2L, recorder.sampledOut());
            Assertions.assertEquals(1, sink.records().size());

            recorder.setSamplingRate(1.0d);
            recorder.record(new EvaluationRecord("u1", 3L, 3L, AT, true, EvaluationRecord.QUEUED));
            Assertions.assertTrue(recorder.flush(Duration.ofSeconds(5)));
            Assertions.assertEquals(1, sink.records(EvaluationRecord.class).size());
        } finally {
            recorder.close(Duration.ofSeconds(2));
        }
    }

    @Test
    void closeFlushesAndClosesTheSink() {
        ClosingSink sink = new ClosingSink();
        TraceRecorder recorder = new TraceRecorder(sink, 16, 1.0d);
        recorder.start();
        recorder.record(event("u1"));

        recorder.close(Duration.ofSeconds(5));

        Assertions.assertEquals(1, sink.delegate.records().size());
        Assertions.assertTrue(sink.closed);
    }

    private static EngineEvent event(String unitId) {
        return EngineEvent.of(EngineEvent.DISABLED, unitId, AT, Map.of("reason", "manual"));
    }

    private static final class ClosingSink implements TraceSink {
        private final MemoryTraceSink delegate = new MemoryTraceSink();
        private volatile boolean closed;

        @Override
        public void write(List<TraceRecord> batch) throws TraceSinkUnavailableException {
            delegate.write(batch);
        }

        @Override
        public String name() {
            return "closing";
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
