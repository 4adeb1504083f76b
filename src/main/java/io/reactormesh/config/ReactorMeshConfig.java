package io.reactormesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ReactorMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final long DEFAULT_CYCLE_INTERVAL_MS = 100L;
    public static final int DEFAULT_WORKER_POOL_SIZE = 8;
    public static final int DEFAULT_WORKER_QUEUE_CAPACITY = 100;
    public static final long DEFAULT_UNIT_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_TIMEOUT_STREAK_LIMIT = 3;
    public static final long DEFAULT_STARVATION_THRESHOLD_MS = 1_000L;
    public static final long DEFAULT_STARVATION_BOOST_INTERVAL_MS = 500L;
    public static final double DEFAULT_STARVATION_BOOST_STEP = 1.0d;
    public static final long DEFAULT_THROTTLE_SAMPLE_INTERVAL_MS = 1_000L;
    public static final int DEFAULT_MAX_MUTATIONS_PER_INTERVAL = 1_000;
    public static final double DEFAULT_THROTTLE_THRESHOLD = 0.6d;
    public static final double DEFAULT_EMERGENCY_THRESHOLD = 0.9d;
    public static final int DEFAULT_TRACE_BUFFER_CAPACITY = 10_000;
    public static final long DEFAULT_TRACE_RETENTION_HOURS = 24L;
    public static final int DEFAULT_MAX_VALUE_BYTES = 1024 * 1024;
    public static final int DEFAULT_MAX_MESH_KEYS = 100_000;
    public static final int DEFAULT_MAX_KEYS_PER_EXECUTION = 1000;
    public static final int MAX_KEY_LENGTH = 512;

    private final Path rootDir;

    public ReactorMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ReactorMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ReactorMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("reactormesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("reactormesh-settings.json");
    }

    public Path aclManifest() {
        return rootDir.resolve("acl.json");
    }

    public Path unitsFile() {
        return rootDir.resolve("units.json");
    }

    public Path traceRoot() {
        return rootDir.resolve("trace");
    }

    public Path traceFile() {
        return traceRoot().resolve("trace.jsonl");
    }

    public Path traceArchiveRoot() {
        return traceRoot().resolve("archive");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path traceSigningKey() {
        return securityRoot().resolve("trace-signing.key");
    }
}
