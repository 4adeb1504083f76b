package io.reactormesh.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.model.MeshEntry;
import io.reactormesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists committed batches to SQLite. Each batch is one transaction; an entry row
 * only moves forward, so a replayed or reordered batch cannot regress a key. Deleted
 * keys stay as tombstone rows so their version survives a restart.
 */
public final class SqliteMeshBackend implements MeshBackend {
    private final Database database;

    public SqliteMeshBackend(Database database) {
        this.database = database;
    }

    @Override
    public StoredMesh loadAll() {
        List<MeshEntry> entries = new ArrayList<>();
        long lastCommitSeq = 0L;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT mesh_key,value_json,version,last_written_by,written_at_ms,deleted FROM mesh_entries ORDER BY mesh_key");
             PreparedStatement seq = c.prepareStatement(
                     "SELECT COALESCE(MAX(commit_seq),0) FROM mesh_commits")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new MeshEntry(
                            rs.getString("mesh_key"),
                            parseValue(rs.getString("value_json")),
                            rs.getLong("version"),
                            rs.getString("last_written_by"),
                            Instant.ofEpochMilli(rs.getLong("written_at_ms")),
                            rs.getInt("deleted") != 0
                    ));
                }
            }
            try (ResultSet rs = seq.executeQuery()) {
                if (rs.next()) {
                    lastCommitSeq = rs.getLong(1);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load mesh entries", e);
        }
        return new StoredMesh(entries, lastCommitSeq);
    }

    @Override
    public void append(CommitBatch batch) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement upsert = c.prepareStatement("""
                    INSERT INTO mesh_entries(mesh_key,value_json,version,last_written_by,written_at_ms,commit_seq,deleted)
                    VALUES(?,?,?,?,?,?,?)
                    ON CONFLICT(mesh_key) DO UPDATE SET
                        value_json=excluded.value_json,
                        deleted=excluded.deleted,
                        version=excluded.version,
                        last_written_by=excluded.last_written_by,
                        written_at_ms=excluded.written_at_ms,
                        commit_seq=excluded.commit_seq
                    WHERE excluded.version > mesh_entries.version
                    """);
                 PreparedStatement log = c.prepareStatement(
                         "INSERT OR IGNORE INTO mesh_commits(commit_seq,writer_id,keys_json,committed_at_ms) VALUES(?,?,?,?)")) {
                for (MeshEntry entry : batch.entries()) {
                    upsert.setString(1, entry.key());
                    upsert.setString(2, Jsons.toCompactJson(entry.value()));
                    upsert.setLong(3, entry.version());
                    upsert.setString(4, entry.lastWrittenBy());
                    upsert.setLong(5, entry.writtenAt().toEpochMilli());
                    upsert.setLong(6, batch.commitSeq());
                    upsert.setInt(7, entry.deleted() ? 1 : 0);
                    upsert.addBatch();
                }
                upsert.executeBatch();
                log.setLong(1, batch.commitSeq());
                log.setString(2, batch.writerId());
                log.setString(3, Jsons.toCompactJson(batch.keys()));
                log.setLong(4, batch.committedAt().toEpochMilli());
                log.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist mesh commit " + batch.commitSeq(), e);
        }
    }

    /**
     * Commit log rows starting at {@code fromSeq}, oldest first.
     */
    public List<CommitLogRow> commitLog(long fromSeq, int limit) {
        List<CommitLogRow> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT commit_seq,writer_id,keys_json,committed_at_ms FROM mesh_commits WHERE commit_seq>=? ORDER BY commit_seq LIMIT ?")) {
            ps.setLong(1, fromSeq);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new CommitLogRow(
                            rs.getLong("commit_seq"),
                            rs.getString("writer_id"),
                            Jsons.mapper().readValue(rs.getString("keys_json"), new TypeReference<List<String>>() {
                            }),
                            rs.getLong("committed_at_ms")
                    ));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed to read mesh commit log", e);
        }
        return out;
    }

    @Override
    public String name() {
        return "sqlite";
    }

    private static JsonNode parseValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Jsons.parse(raw);
    }

    public record CommitLogRow(long commitSeq, String writerId, List<String> keys, long committedAtMs) {
    }
}
