package io.reactormesh.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class EngineSettingsTest {

    @Test
    void missingFileMeansDefaults() {
        Assertions.assertEquals(EngineSettings.defaults(), EngineSettings.load(Path.of("does-not-exist.json")));
        Assertions.assertEquals(EngineSettings.defaults(), EngineSettings.load(null));
    }

    @Test
    void partialFileOverridesOnlyNamedFields() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-settings-");
        try {
            Path file = root.resolve("reactormesh-settings.json");
            Files.writeString(file, """
                    {
                      "cycleIntervalMs": 250,
                      "maxMutationsPerInterval": 40,
                      "traceNoopEvaluations": false,
                      "someFutureKnob": "ignored"
                    }
                    """, StandardCharsets.UTF_8);

            EngineSettings settings = EngineSettings.load(file);
            EngineSettings defaults = EngineSettings.defaults();

            Assertions.assertEquals(250L, settings.cycleIntervalMs());
            Assertions.assertEquals(40, settings.maxMutationsPerInterval());
            Assertions.assertFalse(settings.traceNoopEvaluations());
            Assertions.assertEquals(defaults.workerPoolSize(), settings.workerPoolSize());
            Assertions.assertEquals(
                    List.of("cycleIntervalMs", "maxMutationsPerInterval", "traceNoopEvaluations"),
                    defaults.diff(settings));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void outOfRangeValuesAreClampedAndThresholdsStayOrdered() {
        EngineSettings.SettingsFile raw = new EngineSettings.SettingsFile(
                0L, -3, 0, 0L, 0, -1L, -5L, 0L, -2.0d, 1L, 0,
                0.8d, 0.5d, 1, 0L, null, 7.0d, 1, 0, -4);

        EngineSettings settings = EngineSettings.fromFile(raw, EngineSettings.defaults());

        Assertions.assertEquals(1L, settings.cycleIntervalMs());
        Assertions.assertEquals(1, settings.workerPoolSize());
        Assertions.assertEquals(1, settings.workerQueueCapacity());
        Assertions.assertEquals(1, settings.timeoutStreakLimit());
        Assertions.assertEquals(0L, settings.autoReenableAfterMs());
        Assertions.assertEquals(1L, settings.starvationBoostIntervalMs());
        Assertions.assertEquals(10L, settings.throttleSampleIntervalMs());
        Assertions.assertEquals(0.8d, settings.throttleThreshold());
        Assertions.assertEquals(0.8d, settings.emergencyThreshold());
        Assertions.assertEquals(16, settings.traceBufferCapacity());
        Assertions.assertEquals(1.0d, settings.traceSamplingRate());
        Assertions.assertEquals(64, settings.maxValueBytes());
        Assertions.assertEquals(1, settings.maxMeshKeys());
        Assertions.assertEquals(1, settings.maxKeysPerExecution());
        Assertions.assertTrue(settings.traceNoopEvaluations());
    }

    @Test
    void malformedFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-settings-bad-");
        try {
            Path file = root.resolve("reactormesh-settings.json");
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> EngineSettings.load(file));
            Assertions.assertTrue(error.getMessage().startsWith("Failed to load engine settings"));
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
