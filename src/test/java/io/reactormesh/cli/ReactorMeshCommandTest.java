package io.reactormesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReactorMeshCommandTest {
    @Test
    void parseValueShouldKeepJsonAndWrapPlainText() {
        assertTrue(ReactorMeshCommand.parseValue("{\"a\":1}").isObject());
        assertTrue(ReactorMeshCommand.parseValue("[1,2]").isArray());
        assertEquals(42, ReactorMeshCommand.parseValue("42").asInt());
        assertEquals(-1.5d, ReactorMeshCommand.parseValue("-1.5").asDouble());
        assertTrue(ReactorMeshCommand.parseValue("true").asBoolean());
        assertTrue(ReactorMeshCommand.parseValue("null").isNull());
        assertEquals("quoted", ReactorMeshCommand.parseValue("\"quoted\"").asText());
        assertEquals("hello world", ReactorMeshCommand.parseValue("hello world").asText());
        assertTrue(ReactorMeshCommand.parseValue("hello").isTextual());
    }

    @Test
    void parseValueShouldTreatNumberLikeTextAsText() {
        JsonNode date = ReactorMeshCommand.parseValue("2026-10-18");
        assertTrue(date.isTextual());
        assertEquals("2026-10-18", date.asText());
        assertEquals("12 apples", ReactorMeshCommand.parseValue("12 apples").asText());
        assertEquals("-v", ReactorMeshCommand.parseValue("-v").asText());
        assertEquals("\"half", ReactorMeshCommand.parseValue("\"half").asText());
        assertTrue(ReactorMeshCommand.parseValue("1e3").isNumber());
    }

    @Test
    void parseValueShouldRejectBrokenObjects() {
        assertThrows(IllegalArgumentException.class, () -> ReactorMeshCommand.parseValue("{\"a\":"));
    }

    @Test
    void submitGetAndRunShouldShareTheDataRoot() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-cli-");
        try {
            assertEquals(0, execute(root, "init").exitCode);

            Result submitted = execute(root, "submit", "content.a", "{\"n\":1}", "--expected-version", "0");
            assertEquals(0, submitted.exitCode);
            assertEquals("committed", Jsons.parse(submitted.out).path("status").asText());

            Result stale = execute(root, "submit", "content.a", "{\"n\":2}", "--expected-version", "0");
            assertEquals(1, stale.exitCode);
            assertEquals("conflict", Jsons.parse(stale.out).path("status").asText());

            Result got = execute(root, "get", "content.a");
            assertEquals(0, got.exitCode);
            JsonNode value = Jsons.parse(got.out);
            assertEquals(1L, value.path("version").asLong());
            assertEquals(1, value.path("value").path("n").asInt());

            assertEquals(1, execute(root, "get", "content.missing").exitCode);

            Result ran = execute(root, "run", "--cycles", "2", "--interval-ms", "0");
            assertEquals(0, ran.exitCode);
            assertEquals(2, Jsons.parse(ran.out).path("cycles").size());

            assertEquals(0, execute(root, "trace-verify").exitCode);
            assertTrue(execute(root, "metrics").out.contains("reactormesh_commit_seq 1"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteShouldLeaveTheKeyMissing() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-cli-delete-");
        try {
            assertEquals(0, execute(root, "init").exitCode);
            assertEquals(0, execute(root, "submit", "content.a", "2026-10-18").exitCode);
            assertEquals("2026-10-18", Jsons.parse(execute(root, "get", "content.a").out).path("value").asText());

            Result deleted = execute(root, "delete", "content.a", "--expected-version", "1");
            assertEquals(0, deleted.exitCode);
            JsonNode out = Jsons.parse(deleted.out);
            assertEquals("deleted", out.path("status").asText());
            assertEquals(2L, out.path("version").asLong());

            assertEquals(1, execute(root, "get", "content.a").exitCode);
            Result again = execute(root, "delete", "content.a");
            assertEquals(1, again.exitCode);
            assertEquals("absent", Jsons.parse(again.out).path("status").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void aclValidateShouldFailOnProblems() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-cli-acl-");
        try {
            Path manifest = root.resolve("acl.json");
            Files.writeString(manifest, """
                    {"namespaces":[
                      {"prefix":"content","readers":["*"],"writers":[],"readOnlyForever":false},
                      {"prefix":"content","readers":["*"],"writers":["*"],"readOnlyForever":false}
                    ]}
                    """, StandardCharsets.UTF_8);

            Result result = execute(root, "acl-validate");

            assertEquals(1, result.exitCode);
            JsonNode out = Jsons.parse(result.out);
            assertEquals(false, out.path("valid").asBoolean());
            assertEquals(2, out.path("problems").size());
            assertEquals(1, execute(root, "acl-validate", "--file", root.resolve("none.json").toString()).exitCode);
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result execute(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code;
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            code = new CommandLine(new ReactorMeshCommand()).execute(full);
        } finally {
            System.setOut(original);
        }
        return new Result(code, buffer.toString(StandardCharsets.UTF_8));
    }

    private record Result(int exitCode, String out) {
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
