package io.reactormesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.reactormesh.TestSettings;
import io.reactormesh.acl.AclManifest;
import io.reactormesh.acl.AclRegistry;
import io.reactormesh.config.EngineSettings;
import io.reactormesh.config.ReactorMeshConfig;
import io.reactormesh.store.Database;
import io.reactormesh.store.SqliteMeshBackend;
import io.reactormesh.trace.EngineEvent;
import io.reactormesh.trace.MemoryTraceSink;
import io.reactormesh.trace.MutationRecord;
import io.reactormesh.unit.HeartbeatUnit;
import io.reactormesh.unit.UnitDescriptor;
import io.reactormesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class ReactorMeshRuntimeTest {

    @Test
    void submittedValuesSurviveReopenAndTraceStaysVerifiable() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-runtime-");
        try {
            ReactorMeshConfig config = ReactorMeshConfig.fromRoot(root.toString());
            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(config)) {
                ReactorMeshRuntime.SubmitOutcome first = runtime.submitMutation("content.a", TextNode.valueOf("one"), 0L);
                Assertions.assertTrue(first.accepted());
                Assertions.assertEquals(1L, first.version());

                ReactorMeshRuntime.SubmitOutcome blind = runtime.submitMutation("content.a", TextNode.valueOf("two"), null);
                Assertions.assertEquals(2L, blind.version());

                ReactorMeshRuntime.SubmitOutcome stale = runtime.submitMutation("content.a", TextNode.valueOf("three"), 1L);
                Assertions.assertFalse(stale.accepted());
                Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.CONFLICT, stale.status());
                Assertions.assertEquals(2L, stale.actualVersion());
            }
            Assertions.assertTrue(Files.exists(config.traceSigningKey()));

            try (ReactorMeshRuntime reopened = ReactorMeshRuntime.open(config)) {
                Assertions.assertEquals(2L, reopened.get("content.a").orElseThrow().version());
                Assertions.assertEquals("two", reopened.get("content.a").orElseThrow().value().asText());
                Assertions.assertEquals(2L, reopened.commitSeq());
                List<SqliteMeshBackend.CommitLogRow> log = reopened.commitLog(1L, 10);
                Assertions.assertEquals(2, log.size());
                Assertions.assertEquals(AclRegistry.INGEST_PRINCIPAL, log.get(0).writerId());

                ReactorMeshRuntime.SubmitOutcome next = reopened.submitMutation("content.a", TextNode.valueOf("three"), 2L);
                Assertions.assertEquals(3L, next.version());
                Assertions.assertTrue(reopened.verifyTrace().ok());
                Assertions.assertEquals(3, reopened.traceQuery(AclRegistry.INGEST_PRINCIPAL, "mutation", 10).size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void seededReadOnlyKeysRejectFurtherIngest() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-runtime-acl-");
        try {
            ReactorMeshConfig config = ReactorMeshConfig.fromRoot(root.toString());
            new AclManifest(List.of(
                    new AclManifest.Namespace("config", List.of("*"), List.of(), true),
                    new AclManifest.Namespace("content", List.of("*"), List.of("*"), false)
            )).save(config.aclManifest());

            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(config)) {
                Assertions.assertTrue(runtime.submitMutation("config.mode", TextNode.valueOf("strict"), 0L).accepted());

                ReactorMeshRuntime.SubmitOutcome denied = runtime.submitMutation("config.mode", TextNode.valueOf("lax"), null);

                Assertions.assertFalse(denied.accepted());
                Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.DENIED, denied.status());
                Assertions.assertEquals("strict", runtime.get("config.mode").orElseThrow().value().asText());
                Assertions.assertEquals(1L, runtime.stats().ingestRejected());
                Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));
                Assertions.assertEquals(1, runtime.traceQuery(AclRegistry.INGEST_PRINCIPAL, "security", 10).size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void catalogUnitsRunAgainstIngestedData() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-runtime-units-");
        try {
            ReactorMeshConfig config = ReactorMeshConfig.fromRoot(root.toString());
            Files.createDirectories(root);
            Files.writeString(config.unitsFile(), """
                    {"units":[{"id":"mirror","type":"copy","priority":3,
                               "options":{"source":"content.draft","target":"content.live"}}]}
                    """, StandardCharsets.UTF_8);

            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(config)) {
                Assertions.assertEquals(1, runtime.units().size());
                runtime.submitMutation("content.draft", TextNode.valueOf("hello"), 0L);

                Assertions.assertEquals(1, runtime.runCycle().admitted());
                Assertions.assertTrue(runtime.awaitQuiescence(Duration.ofSeconds(5)));

                Assertions.assertEquals("hello", runtime.get("content.live").orElseThrow().value().asText());
                ReactorMeshRuntime.UnitView mirror = runtime.units().get(0);
                Assertions.assertEquals("mirror", mirror.id());
                Assertions.assertEquals(1L, mirror.counters().success());
                Assertions.assertEquals(0, runtime.runCycle().triggered());

                Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));
                List<JsonNode> mutations = runtime.traceQuery("mirror", "mutation", 5);
                Assertions.assertEquals(1, mutations.size());
                Assertions.assertEquals("content.live", mutations.get(0).path("record").path("keysChanged").get(0).asText());
                Assertions.assertEquals("SUCCESS", mutations.get(0).path("record").path("outcome").asText());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileChangesAreAppliedAndBadFilesIgnored() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-runtime-settings-");
        try {
            ReactorMeshConfig config = ReactorMeshConfig.fromRoot(root.toString());
            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(config)) {
                Assertions.assertEquals("no_changes", runtime.reloadSettings().message());

                Files.writeString(config.settingsFile(), "{\"maxMutationsPerInterval\": 5}", StandardCharsets.UTF_8);
                ReactorMeshRuntime.SettingsReloadOutcome reloaded = runtime.reloadSettings();
                Assertions.assertTrue(reloaded.changed());
                Assertions.assertEquals("reloaded", reloaded.message());
                Assertions.assertEquals(List.of("maxMutationsPerInterval"), reloaded.changedFields());
                Assertions.assertEquals(5, runtime.currentSettings().maxMutationsPerInterval());
                Assertions.assertEquals(5, runtime.stats().admissionBudget());

                Files.writeString(config.settingsFile(), "{ broken", StandardCharsets.UTF_8);
                ReactorMeshRuntime.SettingsReloadOutcome invalid = runtime.reloadSettings();
                Assertions.assertFalse(invalid.changed());
                Assertions.assertTrue(invalid.message().startsWith("invalid: "));
                Assertions.assertEquals(5, runtime.currentSettings().maxMutationsPerInterval());

                runtime.maybeReloadSettings(0L);
                Assertions.assertEquals("skip_interval", runtime.maybeReloadSettings(3_600_000L).message());

                Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));
                Assertions.assertEquals(1, runtime.traceQuery(null, "engine", 50).stream()
                        .filter(row -> EngineEvent.SETTINGS_RELOADED.equals(row.path("record").path("event").asText()))
                        .count());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void corruptPersistedMeshHaltsTheReactor() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-runtime-corrupt-");
        try {
            ReactorMeshConfig config = ReactorMeshConfig.fromRoot(root.toString());
            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(config)) {
                Assertions.assertTrue(runtime.health().ok());
                Assertions.assertEquals("sqlite", runtime.health().backend());
                runtime.submitMutation("content.a", IntNode.valueOf(1), 0L);
            }
            Database db = new Database(config);
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.executeUpdate("UPDATE mesh_entries SET version=0 WHERE mesh_key='content.a'");
            }

            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(config)) {
                Assertions.assertTrue(runtime.halted());
                ReactorMeshRuntime.HealthOutcome health = runtime.health();
                Assertions.assertFalse(health.ok());
                Assertions.assertTrue(health.halted());
                Assertions.assertNotNull(health.haltReason());
                Assertions.assertThrows(IllegalStateException.class, runtime::runCycle);
                Assertions.assertThrows(IllegalStateException.class,
                        () -> runtime.submitMutation("content.b", IntNode.valueOf(1), 0L));
                Assertions.assertTrue(runtime.metricsText().contains("reactormesh_halted 1\n"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void maintenanceArchivesNothingOnAFreshTrace() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-runtime-maint-");
        try {
            try (ReactorMeshRuntime runtime = ReactorMeshRuntime.open(ReactorMeshConfig.fromRoot(root.toString()))) {
                runtime.submitMutation("content.a", IntNode.valueOf(1), 0L);
                Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));

                ReactorMeshRuntime.MaintenanceOutcome outcome = runtime.runMaintenance();

                Assertions.assertEquals(0, outcome.traceRowsArchived());
                Assertions.assertEquals(0, outcome.backendBacklog());
                Assertions.assertEquals(1, runtime.traceTail(10).size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void registrationLifecycleInMemory() throws Exception {
        MemoryTraceSink sink = new MemoryTraceSink();
        try (ReactorMeshRuntime runtime = ReactorMeshRuntime.inMemory(
                EngineSettings.defaults(), AclRegistry.permissive(), sink, Clock.systemUTC())) {
            HeartbeatUnit beat = new HeartbeatUnit("ops.heartbeat");
            runtime.registerUnit(UnitDescriptor.builder("pulse", beat).interests(beat.key()).temporal(true).build());
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.registerUnit(
                    UnitDescriptor.builder("pulse", beat).temporal(true).build()));

            Assertions.assertEquals(1, runtime.runCycle().admitted());
            Assertions.assertTrue(runtime.awaitQuiescence(Duration.ofSeconds(5)));
            Assertions.assertEquals(1L, runtime.get("ops.heartbeat").orElseThrow().value().path("beat").asLong());

            Assertions.assertTrue(runtime.setEnabled("pulse", false));
            Assertions.assertFalse(runtime.setEnabled("pulse", false));
            Assertions.assertEquals(0, runtime.runCycle().evaluated());
            Assertions.assertEquals("manual", runtime.units().get(0).counters().disabledReason());

            Assertions.assertTrue(runtime.deregisterUnit("pulse"));
            Assertions.assertFalse(runtime.deregisterUnit("pulse"));
            Assertions.assertTrue(runtime.units().isEmpty());

            Assertions.assertThrows(IllegalStateException.class, () -> runtime.commitLog(0L, 10));
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.traceTail(10));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.submitMutation("has space", IntNode.valueOf(1), null));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.submitMutation("k", IntNode.valueOf(1), -1L));

            Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));
            List<String> events = sink.records(EngineEvent.class).stream().map(EngineEvent::event).toList();
            Assertions.assertEquals(List.of(EngineEvent.REGISTERED, EngineEvent.DISABLED, EngineEvent.DEREGISTERED), events);
        }
    }

    @Test
    void concurrentIngestSeedsEachReadOnlyKeyExactlyOnce() throws Exception {
        AclRegistry acl = AclRegistry.fromManifest(new AclManifest(List.of(
                new AclManifest.Namespace("frozen", List.of("*"), List.of(), true),
                new AclManifest.Namespace("content", List.of("*"), List.of("*"), false)
        )));
        int threads = 8;
        int keys = 4;
        int rounds = 50;
        try (ReactorMeshRuntime runtime = ReactorMeshRuntime.inMemory(
                EngineSettings.defaults(), acl, new MemoryTraceSink(), Clock.systemUTC())) {
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<List<ReactorMeshRuntime.SubmitOutcome>>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    int writer = t;
                    futures.add(pool.submit(() -> {
                        start.await();
                        List<ReactorMeshRuntime.SubmitOutcome> outcomes = new ArrayList<>();
                        for (int round = 0; round < rounds; round++) {
                            String key = "frozen.k" + (round % keys);
                            outcomes.add(runtime.submitMutation(key, IntNode.valueOf(writer), null));
                        }
                        return outcomes;
                    }));
                }
                start.countDown();

                Map<String, Integer> accepted = new HashMap<>();
                for (Future<List<ReactorMeshRuntime.SubmitOutcome>> future : futures) {
                    for (ReactorMeshRuntime.SubmitOutcome outcome : future.get(30, TimeUnit.SECONDS)) {
                        if (outcome.accepted()) {
                            accepted.merge(outcome.key(), 1, Integer::sum);
                        } else {
                            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.DENIED, outcome.status());
                        }
                    }
                }

                for (int k = 0; k < keys; k++) {
                    String key = "frozen.k" + k;
                    Assertions.assertEquals(1L, runtime.get(key).orElseThrow().version(), key);
                    Assertions.assertEquals(1, accepted.get(key), key);
                }
                Assertions.assertEquals(keys, runtime.stats().ingestAccepted());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void deleteMutationLeavesATombstone() throws Exception {
        AclRegistry acl = AclRegistry.fromManifest(new AclManifest(List.of(
                new AclManifest.Namespace("frozen", List.of("*"), List.of(), true),
                new AclManifest.Namespace("content", List.of("*"), List.of("*"), false)
        )));
        MemoryTraceSink sink = new MemoryTraceSink();
        try (ReactorMeshRuntime runtime = ReactorMeshRuntime.inMemory(
                EngineSettings.defaults(), acl, sink, Clock.systemUTC())) {
            runtime.submitMutation("content.a", TextNode.valueOf("one"), 0L);
            runtime.submitMutation("frozen.seed", TextNode.valueOf("fixed"), null);

            ReactorMeshRuntime.SubmitOutcome stale = runtime.deleteMutation("content.a", 0L);
            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.CONFLICT, stale.status());

            ReactorMeshRuntime.SubmitOutcome deleted = runtime.deleteMutation("content.a", null);
            Assertions.assertTrue(deleted.accepted());
            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.DELETED, deleted.status());
            Assertions.assertEquals(2L, deleted.version());
            Assertions.assertFalse(runtime.exists("content.a"));
            Assertions.assertTrue(runtime.get("content.a").isEmpty());

            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.ABSENT,
                    runtime.deleteMutation("content.a", null).status());
            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.ABSENT,
                    runtime.deleteMutation("content.a", 2L).status());
            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.ABSENT,
                    runtime.deleteMutation("content.never", null).status());

            ReactorMeshRuntime.SubmitOutcome frozen = runtime.deleteMutation("frozen.seed", null);
            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.DENIED, frozen.status());
            Assertions.assertTrue(runtime.exists("frozen.seed"));

            ReactorMeshRuntime.SubmitOutcome recreated = runtime.submitMutation("content.a", TextNode.valueOf("two"), null);
            Assertions.assertEquals(3L, recreated.version());

            Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));
            MutationRecord deletion = sink.records(MutationRecord.class).stream()
                    .filter(r -> "deleted".equals(r.detail()))
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals("one", deletion.before().get("content.a").asText());
            Assertions.assertTrue(deletion.after().containsKey("content.a"));
            Assertions.assertNull(deletion.after().get("content.a"));
        }
    }

    @Test
    void meshKeyCapRejectsIngestOfNewKeys() throws Exception {
        EngineSettings settings = TestSettings.with(Map.of("maxMeshKeys", 2));
        try (ReactorMeshRuntime runtime = ReactorMeshRuntime.inMemory(
                settings, AclRegistry.permissive(), new MemoryTraceSink(), Clock.systemUTC())) {
            Assertions.assertTrue(runtime.submitMutation("k.1", IntNode.valueOf(1), null).accepted());
            Assertions.assertTrue(runtime.submitMutation("k.2", IntNode.valueOf(2), null).accepted());

            ReactorMeshRuntime.SubmitOutcome full = runtime.submitMutation("k.3", IntNode.valueOf(3), null);
            Assertions.assertEquals(ReactorMeshRuntime.SubmitOutcome.REJECTED, full.status());
            Assertions.assertFalse(runtime.exists("k.3"));
            Assertions.assertTrue(runtime.submitMutation("k.1", IntNode.valueOf(10), null).accepted());

            Assertions.assertTrue(runtime.deleteMutation("k.2", null).accepted());
            Assertions.assertTrue(runtime.submitMutation("k.3", IntNode.valueOf(3), null).accepted());
            Assertions.assertEquals(1L, runtime.stats().ingestRejected());
        }
    }

    @Test
    void tracedValueIsIsolatedFromTheCallersNode() throws Exception {
        MemoryTraceSink sink = new MemoryTraceSink();
        try (ReactorMeshRuntime runtime = ReactorMeshRuntime.inMemory(
                EngineSettings.defaults(), AclRegistry.permissive(), sink, Clock.systemUTC())) {
            ObjectNode payload = Jsons.mapper().createObjectNode().put("title", "draft");

            Assertions.assertTrue(runtime.submitMutation("content.a", payload, null).accepted());
            payload.put("title", "changed after submit");

            Assertions.assertTrue(runtime.flushTrace(Duration.ofSeconds(5)));
            MutationRecord record = sink.records(MutationRecord.class).get(0);
            Assertions.assertEquals("draft", record.after().get("content.a").path("title").asText());
            Assertions.assertEquals("draft", runtime.get("content.a").orElseThrow().value().path("title").asText());
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
