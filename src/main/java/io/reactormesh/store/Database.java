package io.reactormesh.store;

import io.reactormesh.config.ReactorMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

public final class Database {
    private final ReactorMeshConfig config;
    private final String jdbcUrl;

    public Database(ReactorMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    public boolean isReachable() {
        try (Connection ignored = openConnection()) {
            return true;
        } catch (SQLException e) {
            return false;
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS mesh_entries (
                        mesh_key TEXT PRIMARY KEY,
                        value_json TEXT,
                        version INTEGER NOT NULL,
                        last_written_by TEXT NOT NULL,
                        written_at_ms INTEGER NOT NULL,
                        commit_seq INTEGER NOT NULL,
                        deleted INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            migrateMeshEntries(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS mesh_commits (
                        commit_seq INTEGER PRIMARY KEY,
                        writer_id TEXT NOT NULL,
                        keys_json TEXT NOT NULL,
                        committed_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_mesh_commits_time ON mesh_commits(committed_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void migrateMeshEntries(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(mesh_entries)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        if (!columns.contains("deleted")) {
            try (Statement st = conn.createStatement()) {
                st.execute("ALTER TABLE mesh_entries ADD COLUMN deleted INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " returned no rows");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException("PRAGMA " + pragma + " expected " + expected + " but was " + actual);
            }
        }
    }
}
