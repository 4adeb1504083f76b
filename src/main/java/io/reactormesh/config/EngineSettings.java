package io.reactormesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.reactormesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Every engine tunable, immutable once built.
 *
 * <p>Instances come from {@link #defaults()} or from a {@code reactormesh-settings.json}
 * document through {@link #load(Path)}; absent fields keep their default and every
 * value is clamped to a sane minimum.
 */
public record EngineSettings(
        long cycleIntervalMs,
        int workerPoolSize,
        int workerQueueCapacity,
        long defaultUnitTimeoutMs,
        int timeoutStreakLimit,
        long autoReenableAfterMs,
        long starvationThresholdMs,
        long starvationBoostIntervalMs,
        double starvationBoostStep,
        long throttleSampleIntervalMs,
        int maxMutationsPerInterval,
        double throttleThreshold,
        double emergencyThreshold,
        int traceBufferCapacity,
        long traceRetentionHours,
        boolean traceNoopEvaluations,
        double traceSamplingRate,
        int maxValueBytes,
        int maxMeshKeys,
        int maxKeysPerExecution
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
                ReactorMeshConfig.DEFAULT_CYCLE_INTERVAL_MS,
                ReactorMeshConfig.DEFAULT_WORKER_POOL_SIZE,
                ReactorMeshConfig.DEFAULT_WORKER_QUEUE_CAPACITY,
                ReactorMeshConfig.DEFAULT_UNIT_TIMEOUT_MS,
                ReactorMeshConfig.DEFAULT_TIMEOUT_STREAK_LIMIT,
                0L,
                ReactorMeshConfig.DEFAULT_STARVATION_THRESHOLD_MS,
                ReactorMeshConfig.DEFAULT_STARVATION_BOOST_INTERVAL_MS,
                ReactorMeshConfig.DEFAULT_STARVATION_BOOST_STEP,
                ReactorMeshConfig.DEFAULT_THROTTLE_SAMPLE_INTERVAL_MS,
                ReactorMeshConfig.DEFAULT_MAX_MUTATIONS_PER_INTERVAL,
                ReactorMeshConfig.DEFAULT_THROTTLE_THRESHOLD,
                ReactorMeshConfig.DEFAULT_EMERGENCY_THRESHOLD,
                ReactorMeshConfig.DEFAULT_TRACE_BUFFER_CAPACITY,
                ReactorMeshConfig.DEFAULT_TRACE_RETENTION_HOURS,
                true,
                1.0d,
                ReactorMeshConfig.DEFAULT_MAX_VALUE_BYTES,
                ReactorMeshConfig.DEFAULT_MAX_MESH_KEYS,
                ReactorMeshConfig.DEFAULT_MAX_KEYS_PER_EXECUTION
        );
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + file, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        double throttle = clampRatio(file.throttleThreshold(), defaults.throttleThreshold());
        double emergency = clampRatio(file.emergencyThreshold(), defaults.emergencyThreshold());
        if (emergency < throttle) {
            emergency = throttle;
        }
        return new EngineSettings(
                sanitizeLong(file.cycleIntervalMs(), defaults.cycleIntervalMs(), 1L),
                sanitizeInt(file.workerPoolSize(), defaults.workerPoolSize(), 1),
                sanitizeInt(file.workerQueueCapacity(), defaults.workerQueueCapacity(), 1),
                sanitizeLong(file.defaultUnitTimeoutMs(), defaults.defaultUnitTimeoutMs(), 1L),
                sanitizeInt(file.timeoutStreakLimit(), defaults.timeoutStreakLimit(), 1),
                sanitizeLong(file.autoReenableAfterMs(), defaults.autoReenableAfterMs(), 0L),
                sanitizeLong(file.starvationThresholdMs(), defaults.starvationThresholdMs(), 0L),
                sanitizeLong(file.starvationBoostIntervalMs(), defaults.starvationBoostIntervalMs(), 1L),
                sanitizeDouble(file.starvationBoostStep(), defaults.starvationBoostStep(), 0.001d),
                sanitizeLong(file.throttleSampleIntervalMs(), defaults.throttleSampleIntervalMs(), 10L),
                sanitizeInt(file.maxMutationsPerInterval(), defaults.maxMutationsPerInterval(), 1),
                throttle,
                emergency,
                sanitizeInt(file.traceBufferCapacity(), defaults.traceBufferCapacity(), 16),
                sanitizeLong(file.traceRetentionHours(), defaults.traceRetentionHours(), 1L),
                file.traceNoopEvaluations() == null ? defaults.traceNoopEvaluations() : file.traceNoopEvaluations(),
                clampRatio(file.traceSamplingRate(), defaults.traceSamplingRate()),
                sanitizeInt(file.maxValueBytes(), defaults.maxValueBytes(), 64),
                sanitizeInt(file.maxMeshKeys(), defaults.maxMeshKeys(), 1),
                sanitizeInt(file.maxKeysPerExecution(), defaults.maxKeysPerExecution(), 1)
        );
    }

    public List<String> diff(EngineSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (cycleIntervalMs != other.cycleIntervalMs) changed.add("cycleIntervalMs");
        if (workerPoolSize != other.workerPoolSize) changed.add("workerPoolSize");
        if (workerQueueCapacity != other.workerQueueCapacity) changed.add("workerQueueCapacity");
        if (defaultUnitTimeoutMs != other.defaultUnitTimeoutMs) changed.add("defaultUnitTimeoutMs");
        if (timeoutStreakLimit != other.timeoutStreakLimit) changed.add("timeoutStreakLimit");
        if (autoReenableAfterMs != other.autoReenableAfterMs) changed.add("autoReenableAfterMs");
        if (starvationThresholdMs != other.starvationThresholdMs) changed.add("starvationThresholdMs");
        if (starvationBoostIntervalMs != other.starvationBoostIntervalMs) changed.add("starvationBoostIntervalMs");
        if (Double.compare(starvationBoostStep, other.starvationBoostStep) != 0) changed.add("starvationBoostStep");
        if (throttleSampleIntervalMs != other.throttleSampleIntervalMs) changed.add("throttleSampleIntervalMs");
        if (maxMutationsPerInterval != other.maxMutationsPerInterval) changed.add("maxMutationsPerInterval");
        if (Double.compare(throttleThreshold, other.throttleThreshold) != 0) changed.add("throttleThreshold");
        if (Double.compare(emergencyThreshold, other.emergencyThreshold) != 0) changed.add("emergencyThreshold");
        if (traceBufferCapacity != other.traceBufferCapacity) changed.add("traceBufferCapacity");
        if (traceRetentionHours != other.traceRetentionHours) changed.add("traceRetentionHours");
        if (traceNoopEvaluations != other.traceNoopEvaluations) changed.add("traceNoopEvaluations");
        if (Double.compare(traceSamplingRate, other.traceSamplingRate) != 0) changed.add("traceSamplingRate");
        if (maxValueBytes != other.maxValueBytes) changed.add("maxValueBytes");
        if (maxMeshKeys != other.maxMeshKeys) changed.add("maxMeshKeys");
        if (maxKeysPerExecution != other.maxKeysPerExecution) changed.add("maxKeysPerExecution");
        return changed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double clampRatio(Double raw, double fallback) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(0.0d, Math.min(1.0d, raw));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long cycleIntervalMs,
            Integer workerPoolSize,
            Integer workerQueueCapacity,
            Long defaultUnitTimeoutMs,
            Integer timeoutStreakLimit,
            Long autoReenableAfterMs,
            Long starvationThresholdMs,
            Long starvationBoostIntervalMs,
            Double starvationBoostStep,
            Long throttleSampleIntervalMs,
            Integer maxMutationsPerInterval,
            Double throttleThreshold,
            Double emergencyThreshold,
            Integer traceBufferCapacity,
            Long traceRetentionHours,
            Boolean traceNoopEvaluations,
            Double traceSamplingRate,
            Integer maxValueBytes,
            Integer maxMeshKeys,
            Integer maxKeysPerExecution
    ) {
    }
}
