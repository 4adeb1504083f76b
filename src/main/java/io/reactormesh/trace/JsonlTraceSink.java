package io.reactormesh.trace;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.util.Hashing;
import io.reactormesh.util.Jsons;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Trace as JSON lines. Every row carries the hash of the previous row
 * ({@code prev_hash}), its own SHA-256 {@code hash} over the row without hash and
 * signature, and an HMAC {@code signature} of that hash.
 */
public final class JsonlTraceSink implements TraceSink {
    private static final String HASH_FIELD = ",\"hash\":\"";

    private final Path traceFile;
    private final Path archiveRoot;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public JsonlTraceSink(Path traceFile, Path archiveRoot, String signingSecret, Clock clock) {
        this.traceFile = traceFile;
        this.archiveRoot = archiveRoot;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Files.createDirectories(traceFile.getParent());
            Files.createDirectories(archiveRoot);
            if (!Files.exists(traceFile)) {
                try {
                    Files.createFile(traceFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently; appending below works either way.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize trace file: " + traceFile, e);
        }
        this.previousHash = lastHash(traceFile);
    }

    @Override
    public synchronized void write(List<TraceRecord> batch) throws TraceSinkUnavailableException {
        if (batch.isEmpty()) {
            return;
        }
        String chain = previousHash;
        StringBuilder lines = new StringBuilder();
        for (TraceRecord record : batch) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", clock.instant().toString());
            row.put("kind", record.kind());
            row.put("unit_id", record.unitId());
            row.put("at", record.at() == null ? null : record.at().toString());
            row.put("record", Jsons.toNode(record));
            row.put("prev_hash", chain);
            String payload = Jsons.toCompactJson(row);
            String rowHash = Hashing.sha256Hex(payload);
            StringBuilder line = new StringBuilder(payload.length() + 160);
            line.append(payload, 0, payload.length() - 1)
                    .append(HASH_FIELD).append(rowHash).append('"');
            if (!signingSecret.isBlank()) {
                line.append(",\"signature\":\"").append(Hashing.hmacSha256Hex(signingSecret, rowHash)).append('"');
            }
            line.append('}');
            lines.append(line).append('\n');
            chain = rowHash;
        }
        try {
            Files.writeString(traceFile, lines.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new TraceSinkUnavailableException("Failed to append trace batch: " + traceFile, e);
        }
        previousHash = chain;
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public VerifyOutcome verify() {
        return verify(traceFile, signingSecret);
    }

    /**
     * Checks every row's hash, signature and link to the row before it. The first row's
     * {@code prev_hash} is taken as the anchor, so pruned files still verify.
     */
    public static VerifyOutcome verify(Path file, String signingSecret) {
        List<String> lines = readLines(file);
        String expectedPrev = null;
        int row = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            row++;
            int cut = line.lastIndexOf(HASH_FIELD);
            if (cut < 0) {
                return VerifyOutcome.broken(file, row, "missing hash");
            }
            String payload = line.substring(0, cut) + "}";
            JsonNode node = Jsons.parse(line);
            String hash = node.path("hash").asText("");
            if (!Hashing.sha256Hex(payload).equals(hash)) {
                return VerifyOutcome.broken(file, row, "hash mismatch");
            }
            String prev = node.path("prev_hash").asText("");
            if (expectedPrev != null && !expectedPrev.equals(prev)) {
                return VerifyOutcome.broken(file, row, "chain broken");
            }
            if (signingSecret != null && !signingSecret.isBlank()) {
                String signature = node.path("signature").asText("");
                if (!Hashing.hmacSha256Hex(signingSecret.trim(), hash).equals(signature)) {
                    return VerifyOutcome.broken(file, row, "signature mismatch");
                }
            }
            expectedPrev = hash;
        }
        return new VerifyOutcome(true, file.toString(), row, -1, "ok");
    }

    /**
     * Moves rows whose {@code timestamp} is before {@code cutoff} into
     * {@code archive/trace-<yyyy-MM-dd>.jsonl}, grouped by UTC day.
     */
    public synchronized PruneOutcome prune(Instant cutoff) {
        List<String> lines = readLines(traceFile);
        Map<LocalDate, List<String>> archived = new TreeMap<>();
        List<String> kept = new ArrayList<>();
        int archivedRows = 0;
        boolean archiving = true;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Instant at = Instant.parse(Jsons.parse(line).path("timestamp").asText());
            // Rows are appended in time order; stop at the first one inside the window.
            if (archiving && at.isBefore(cutoff)) {
                archived.computeIfAbsent(LocalDate.ofInstant(at, ZoneOffset.UTC), d -> new ArrayList<>()).add(line);
                archivedRows++;
            } else {
                archiving = false;
                kept.add(line);
            }
        }
        List<String> files = new ArrayList<>();
        if (archivedRows == 0) {
            return new PruneOutcome(0, kept.size(), files);
        }
        try {
            for (Map.Entry<LocalDate, List<String>> day : archived.entrySet()) {
                Path archive = archiveRoot.resolve("trace-" + day.getKey() + ".jsonl");
                Files.write(archive, day.getValue(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
                files.add(archive.toString());
            }
            Path tmp = traceFile.resolveSibling(traceFile.getFileName() + ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                for (String line : kept) {
                    writer.write(line);
                    writer.write('\n');
                }
            }
            Files.move(tmp, traceFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to prune trace file: " + traceFile, e);
        }
        return new PruneOutcome(archivedRows, kept.size(), files);
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        Deque<JsonNode> window = new ArrayDeque<>();
        int max = Math.max(1, limit);
        for (String line : readLines(traceFile)) {
            if (line.isBlank()) {
                continue;
            }
            window.addLast(Jsons.parse(line));
            if (window.size() > max) {
                window.removeFirst();
            }
        }
        return new ArrayList<>(window);
    }

    /**
     * Most recent {@code limit} rows matching the optional unit and kind filters, oldest first.
     */
    public List<JsonNode> query(String unitId, String kind, int limit) {
        Deque<JsonNode> window = new ArrayDeque<>();
        int max = Math.max(1, limit);
        for (String line : readLines(traceFile)) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.parse(line);
            if (unitId != null && !unitId.isBlank() && !unitId.equals(node.path("unit_id").asText(null))) {
                continue;
            }
            if (kind != null && !kind.isBlank() && !kind.equalsIgnoreCase(node.path("kind").asText(""))) {
                continue;
            }
            window.addLast(node);
            if (window.size() > max) {
                window.removeFirst();
            }
        }
        return new ArrayList<>(window);
    }

    public Path traceFile() {
        return traceFile;
    }

    @Override
    public String name() {
        return "jsonl";
    }

    private static String lastHash(Path file) {
        String last = "";
        for (String line : readLines(file)) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        return Jsons.parse(last).path("hash").asText("");
    }

    private static List<String> readLines(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read trace file: " + file, e);
        }
    }

    public record VerifyOutcome(boolean ok, String file, int rows, int firstBadRow, String message) {
        static VerifyOutcome broken(Path file, int row, String message) {
            return new VerifyOutcome(false, file.toString(), row, row, message);
        }
    }

    public record PruneOutcome(int archivedRows, int keptRows, List<String> archiveFiles) {
    }
}
