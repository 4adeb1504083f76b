package io.reactormesh.store;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.reactormesh.TestClock;
import io.reactormesh.config.ReactorMeshConfig;
import io.reactormesh.model.MeshEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class SqliteMeshBackendTest {

    @Test
    void committedEntriesSurviveRestart() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-sqlite-");
        try {
            TestClock clock = TestClock.startingAt("2026-03-01T00:00:00Z");
            Database db = new Database(ReactorMeshConfig.fromRoot(root.toString()));
            db.init();

            VersionStore first = new VersionStore(new SqliteMeshBackend(db), clock, 4096);
            first.compareAndSet("ingest", "content.a", 0L, TextNode.valueOf("one"));
            first.compareAndSet("ingest", "content.a", 1L, TextNode.valueOf("two"));
            first.commit("unit-x", List.of(
                    new PendingWrite("content.b", IntNode.valueOf(7), 0L),
                    new PendingWrite("content.c", IntNode.valueOf(8), 0L)
            ));
            first.close();

            VersionStore second = new VersionStore(new SqliteMeshBackend(db), clock, 4096);
            second.restoreFromBackend();

            Assertions.assertEquals(3L, second.current().commitSeq());
            Assertions.assertEquals(2L, second.version("content.a"));
            Assertions.assertEquals("two", second.get("content.a").orElseThrow().value().asText());
            MeshEntry b = second.entry("content.b").orElseThrow();
            Assertions.assertEquals("unit-x", b.lastWrittenBy());
            Assertions.assertEquals(7, b.value().asInt());

            CasResult next = second.compareAndSet("ingest", "content.a", 2L, TextNode.valueOf("three"));
            Assertions.assertTrue(next.committed());
            Assertions.assertEquals(3L, next.newVersion());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tombstonesSurviveRestart() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-sqlite-tombstone-");
        try {
            TestClock clock = TestClock.startingAt("2026-03-01T00:00:00Z");
            Database db = new Database(ReactorMeshConfig.fromRoot(root.toString()));
            db.init();

            VersionStore first = new VersionStore(new SqliteMeshBackend(db), clock, 4096);
            first.compareAndSet("ingest", "content.a", 0L, TextNode.valueOf("one"));
            first.compareAndSet("ingest", "content.keep", 0L, TextNode.valueOf("kept"));
            Assertions.assertTrue(first.delete("ingest", "content.a", 1L).committed());
            first.close();

            VersionStore second = new VersionStore(new SqliteMeshBackend(db), clock, 4096);
            second.restoreFromBackend();

            Assertions.assertFalse(second.exists("content.a"));
            Assertions.assertEquals(2L, second.version("content.a"));
            Assertions.assertEquals(1, second.entries().size());
            Assertions.assertEquals(2, second.current().tombstones() + second.current().size());
            Assertions.assertFalse(second.compareAndSet("ingest", "content.a", 0L, TextNode.valueOf("again")).committed());
            Assertions.assertEquals(3L, second.compareAndSet("ingest", "content.a", 2L, TextNode.valueOf("again")).newVersion());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replayedBatchCannotRegressAKeyAndCommitLogIsOrdered() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-sqlite-log-");
        try {
            TestClock clock = TestClock.startingAt("2026-03-01T00:00:00Z");
            Database db = new Database(ReactorMeshConfig.fromRoot(root.toString()));
            db.init();
            SqliteMeshBackend backend = new SqliteMeshBackend(db);
            VersionStore store = new VersionStore(backend, clock, 4096);
            store.compareAndSet("w", "k", 0L, IntNode.valueOf(1));
            store.compareAndSet("w", "k", 1L, IntNode.valueOf(2));

            backend.append(new CommitBatch(1L, "w", clock.instant(),
                    List.of(new MeshEntry("k", IntNode.valueOf(1), 1L, "w", clock.instant()))));

            MeshBackend.StoredMesh stored = backend.loadAll();
            Assertions.assertEquals(1, stored.entries().size());
            Assertions.assertEquals(2L, stored.entries().get(0).version());
            Assertions.assertEquals(2L, stored.lastCommitSeq());

            List<SqliteMeshBackend.CommitLogRow> log = backend.commitLog(1L, 10);
            Assertions.assertEquals(2, log.size());
            Assertions.assertEquals(1L, log.get(0).commitSeq());
            Assertions.assertEquals(List.of("k"), log.get(1).keys());
        } finally {
            deleteRecursively(root);
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
