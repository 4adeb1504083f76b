package io.reactormesh.unit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.model.ExecutionPolicy;
import io.reactormesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds descriptors for the built-in unit types declared in {@code units.json}:
 * <pre>
 * {"units":[{"id":"mirror","type":"copy","priority":5,"mutexGroup":"content-ops",
 *            "options":{"source":"content.draft","target":"content.live"}}]}
 * </pre>
 */
public final class UnitCatalog {
    private UnitCatalog() {
    }

    public static List<UnitDescriptor> load(Path file) {
        if (file == null || !Files.exists(file)) {
            return List.of();
        }
        try {
            CatalogFile raw = Jsons.mapper().readValue(file.toFile(), CatalogFile.class);
            List<UnitDescriptor> out = new ArrayList<>();
            if (raw.units() != null) {
                for (UnitSpec spec : raw.units()) {
                    out.add(create(spec));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read unit catalog: " + file, e);
        }
    }

    public static UnitDescriptor create(UnitSpec spec) {
        if (spec == null || spec.id() == null || spec.id().isBlank()) {
            throw new IllegalArgumentException("unit entry without id");
        }
        String type = spec.type() == null ? "" : spec.type().trim().toLowerCase();
        JsonNode options = spec.options() == null ? Jsons.mapper().createObjectNode() : spec.options();
        UnitDescriptor.Builder builder;
        switch (type) {
            case "copy" -> {
                CopyUnit unit = new CopyUnit(requireText(spec, options, "source"), requireText(spec, options, "target"));
                builder = UnitDescriptor.builder(spec.id(), unit).interests(unit.interests());
            }
            case "heartbeat" -> {
                HeartbeatUnit unit = new HeartbeatUnit(requireText(spec, options, "key"));
                if (spec.cooldownMs() != null && options.has("intervalMs")) {
                    throw new IllegalArgumentException("heartbeat unit " + spec.id()
                            + " sets both cooldownMs and options.intervalMs");
                }
                long intervalMs = Math.max(1L, options.path("intervalMs").asLong(1_000L));
                builder = UnitDescriptor.builder(spec.id(), unit)
                        .interests(unit.key())
                        .temporal(true)
                        .cooldown(Duration.ofMillis(intervalMs));
            }
            case "script" -> {
                List<String> command = new ArrayList<>();
                options.path("command").forEach(n -> command.add(n.asText()));
                builder = UnitDescriptor.builder(spec.id(), new ScriptUnit(spec.id(), command))
                        .interests(spec.interests() == null ? List.of() : spec.interests());
            }
            default -> throw new IllegalArgumentException("Unknown unit type for " + spec.id() + ": " + spec.type());
        }
        builder.priority(spec.priority() == null ? 0 : spec.priority())
                .mutexGroup(spec.mutexGroup())
                .executionPolicy(ExecutionPolicy.fromString(spec.executionPolicy()))
                .critical(Boolean.TRUE.equals(spec.critical()));
        if (spec.cooldownMs() != null) {
            builder.cooldown(Duration.ofMillis(Math.max(0L, spec.cooldownMs())));
        }
        if (spec.timeoutMs() != null) {
            builder.timeout(Duration.ofMillis(Math.max(1L, spec.timeoutMs())));
        }
        return builder.build();
    }

    private static String requireText(UnitSpec spec, JsonNode options, String field) {
        String value = options.path(field).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException("unit " + spec.id() + " (" + spec.type() + ") requires option " + field);
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogFile(List<UnitSpec> units) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UnitSpec(
            String id,
            String type,
            Integer priority,
            Long cooldownMs,
            String mutexGroup,
            String executionPolicy,
            Boolean critical,
            Long timeoutMs,
            List<String> interests,
            JsonNode options
    ) {
    }
}
