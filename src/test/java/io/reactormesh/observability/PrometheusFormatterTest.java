package io.reactormesh.observability;

import com.fasterxml.jackson.databind.node.IntNode;
import io.reactormesh.acl.AclRegistry;
import io.reactormesh.config.EngineSettings;
import io.reactormesh.runtime.ReactorMeshRuntime;
import io.reactormesh.trace.MemoryTraceSink;
import io.reactormesh.unit.CopyUnit;
import io.reactormesh.unit.UnitDescriptor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

final class PrometheusFormatterTest {

    @Test
    void rendersEngineAndPerUnitSeries() throws Exception {
        try (ReactorMeshRuntime runtime = ReactorMeshRuntime.inMemory(
                EngineSettings.defaults(), AclRegistry.permissive(), new MemoryTraceSink(), Clock.systemUTC())) {
            CopyUnit copy = new CopyUnit("content.raw", "content.copy");
            runtime.registerUnit(UnitDescriptor.builder("copy\"er", copy)
                    .mutexGroup("content-ops")
                    .interests(copy.interests())
                    .build());
            runtime.submitMutation("content.raw", IntNode.valueOf(5), 0L);
            runtime.runCycle();
            Assertions.assertTrue(runtime.awaitQuiescence(Duration.ofSeconds(5)));

            String text = PrometheusFormatter.format(runtime.stats());

            Assertions.assertTrue(text.contains("# TYPE reactormesh_commit_seq gauge\n"));
            Assertions.assertTrue(text.contains("reactormesh_commit_seq 2\n"));
            Assertions.assertTrue(text.contains("reactormesh_halted 0\n"));
            Assertions.assertTrue(text.contains("reactormesh_throttle_mode{mode=\"NORMAL\"} 1\n"));
            Assertions.assertTrue(text.contains("reactormesh_ingest_total{result=\"accepted\"} 1\n"));
            Assertions.assertTrue(text.contains("reactormesh_units{state=\"registered\"} 1\n"));
            Assertions.assertTrue(text.contains("reactormesh_scheduler_events_total{event=\"success\"} 1\n"));
            Assertions.assertTrue(text.contains("reactormesh_unit_outcomes_total{unit=\"copy\\\"er\",outcome=\"success\"} 1\n"));
            Assertions.assertTrue(text.contains("reactormesh_unit_enabled{unit=\"copy\\\"er\"} 1\n"));
            Assertions.assertTrue(text.contains("reactormesh_trace_sink_available{sink=\"memory\"} 1\n"));
            Assertions.assertEquals(text.indexOf("# HELP reactormesh_ingest_total "),
                    text.lastIndexOf("# HELP reactormesh_ingest_total "));
        }
    }
}
