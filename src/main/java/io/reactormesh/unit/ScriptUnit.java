package io.reactormesh.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reactormesh.model.Snapshot;
import io.reactormesh.model.VersionedValue;
import io.reactormesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per execution. The unit's snapshot goes to stdin as
 * {@code {"cycle":..,"entries":{key:{"value":..,"version":..}}}}; stdout must be a
 * JSON object whose fields are the keys to write.
 */
public final class ScriptUnit implements Unit {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long POLL_MS = 50L;

    private final String id;
    private final List<String> command;

    public ScriptUnit(String id, List<String> command) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script unit id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script unit command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
    }

    @Override
    public boolean trigger(Snapshot snapshot) {
        return snapshot.size() > 0;
    }

    @Override
    public void act(MeshHandle mesh) throws Exception {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IllegalStateException("script spawn failed for " + id + ": " + e.getMessage(), e);
        }
        mesh.onCancel(process::destroyForcibly);
        try {
            CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(input(mesh)).getBytes(StandardCharsets.UTF_8));
            }
            while (!process.waitFor(POLL_MS, TimeUnit.MILLISECONDS)) {
                mesh.checkpoint();
            }
            mesh.checkpoint();
            String output = new String(stdout.get(), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script " + id + " exit=" + process.exitValue() + " output=" + truncate(output));
            }
            applyOutput(mesh, output);
        } catch (ExecutionException e) {
            throw new IllegalStateException("script " + id + " output unreadable", e.getCause());
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private ObjectNode input(MeshHandle mesh) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("unit", id);
        root.put("cycle", mesh.cycleId());
        root.put("capturedAt", mesh.snapshot().capturedAt().toString());
        ObjectNode entries = root.putObject("entries");
        for (String key : mesh.snapshot().keys()) {
            VersionedValue value = mesh.snapshot().get(key).orElseThrow();
            ObjectNode entry = entries.putObject(key);
            entry.set("value", value.value());
            entry.put("version", value.version());
        }
        return root;
    }

    private void applyOutput(MeshHandle mesh, String output) {
        if (output.isEmpty()) {
            return;
        }
        JsonNode parsed = Jsons.parse(output);
        if (!parsed.isObject()) {
            throw new IllegalStateException("script " + id + " must print a JSON object, got: " + truncate(output));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parsed.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            mesh.write(field.getKey(), field.getValue());
        }
    }

    private static byte[] readAll(InputStream in) {
        try {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read script output", e);
        }
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
