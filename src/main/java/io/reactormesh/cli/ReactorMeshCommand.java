package io.reactormesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sun.net.httpserver.HttpServer;
import io.reactormesh.config.ReactorMeshConfig;
import io.reactormesh.model.VersionedValue;
import io.reactormesh.runtime.ReactorMeshRuntime;
import io.reactormesh.scheduler.CycleReport;
import io.reactormesh.trace.JsonlTraceSink;
import io.reactormesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "reactormesh",
        mixinStandardHelpOptions = true,
        description = "Mesh coordination engine CLI",
        subcommands = {
                ReactorMeshCommand.InitCommand.class,
                ReactorMeshCommand.SubmitCommand.class,
                ReactorMeshCommand.DeleteCommand.class,
                ReactorMeshCommand.GetCommand.class,
                ReactorMeshCommand.DumpCommand.class,
                ReactorMeshCommand.CommitsCommand.class,
                ReactorMeshCommand.RunCommand.class,
                ReactorMeshCommand.UnitsCommand.class,
                ReactorMeshCommand.AclValidateCommand.class,
                ReactorMeshCommand.TraceTailCommand.class,
                ReactorMeshCommand.TraceQueryCommand.class,
                ReactorMeshCommand.TraceVerifyCommand.class,
                ReactorMeshCommand.TracePruneCommand.class,
                ReactorMeshCommand.HealthCommand.class,
                ReactorMeshCommand.StatsCommand.class,
                ReactorMeshCommand.MetricsCommand.class,
                ReactorMeshCommand.SettingsCommand.class
        }
)
public final class ReactorMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Engine data root directory", defaultValue = ReactorMeshConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | delete | get | dump | commits | run | units | acl-validate | trace-tail | trace-query | trace-verify | trace-prune | health | stats | metrics | settings");
    }

    ReactorMeshConfig config() {
        return ReactorMeshConfig.fromRoot(root);
    }

    ReactorMeshRuntime runtime() {
        return ReactorMeshRuntime.open(config());
    }

    /**
     * Parses {@code raw} as JSON, falling back to a JSON string for bare text. Objects
     * and arrays must be valid JSON; anything else that does not parse, such as
     * {@code 2026-10-18}, is kept as text.
     */
    static JsonNode parseValue(String raw) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return TextNode.valueOf(raw);
        }
        char first = trimmed.charAt(0);
        if (first == '{' || first == '[') {
            return Jsons.parse(trimmed);
        }
        boolean looksJson = first == '"' || first == '-' || Character.isDigit(first)
                || "true".equals(trimmed) || "false".equals(trimmed) || "null".equals(trimmed);
        if (!looksJson) {
            return TextNode.valueOf(raw);
        }
        try {
            return Jsons.parse(trimmed);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(raw);
        }
    }

    @Command(name = "init", description = "Create the data root, SQLite schema and trace signing key")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime ignored = parent.runtime()) {
                System.out.println("Initialized ReactorMesh at: " + parent.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Write a key through the ingest API")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Parameters(index = "0", description = "Mesh key")
        String key;

        @Parameters(index = "1", description = "Value (JSON, or plain text stored as a string)")
        String value;

        @Option(names = {"--expected-version"}, description = "Fail unless the key is at this version (0 = absent)")
        Long expectedVersion;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                ReactorMeshRuntime.SubmitOutcome out = runtime.submitMutation(key, parseValue(value), expectedVersion);
                System.out.println(Jsons.toJson(out));
                return out.accepted() ? 0 : 1;
            }
        }
    }

    @Command(name = "delete", description = "Delete a key through the ingest API, leaving a tombstone version")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Parameters(index = "0", description = "Mesh key")
        String key;

        @Option(names = {"--expected-version"}, description = "Fail unless the key is at this version")
        Long expectedVersion;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                ReactorMeshRuntime.SubmitOutcome out = runtime.deleteMutation(key, expectedVersion);
                System.out.println(Jsons.toJson(out));
                return out.accepted() ? 0 : 1;
            }
        }
    }

    @Command(name = "get", description = "Read the current value and version of a key")
    static final class GetCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Parameters(index = "0", description = "Mesh key")
        String key;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                Optional<VersionedValue> value = runtime.get(key);
                if (value.isEmpty()) {
                    System.out.println("Key not found: " + key);
                    return 1;
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("key", key);
                out.put("version", value.get().version());
                out.put("value", value.get().value());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "dump", description = "Print every mesh entry")
    static final class DumpCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--prefix"}, description = "Only keys starting with this prefix")
        String prefix;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.entries().stream()
                        .filter(e -> prefix == null || e.key().startsWith(prefix))
                        .toList()));
                return 0;
            }
        }
    }

    @Command(name = "commits", description = "Show the persisted commit log")
    static final class CommitsCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--from"}, defaultValue = "1", description = "First commit sequence")
        long from;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.commitLog(from, limit)));
                return 0;
            }
        }
    }

    @Command(name = "run", description = "Run reactor cycles over the configured units")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--cycles"}, defaultValue = "0", description = "Cycles to run before exiting (0 = run until stopped)")
        int cycles;

        @Option(names = {"--interval-ms"}, defaultValue = "-1", description = "Pause between cycles (-1 uses settings)")
        long intervalMs;

        @Option(names = {"--pressure"}, description = "External pressure signal in [0,1]")
        Double pressure;

        @Option(names = {"--metrics-port"}, defaultValue = "0", description = "Serve /metrics and /health on this port (0 = off)")
        int metricsPort;

        @Option(names = {"--drain-timeout-ms"}, defaultValue = "30000", description = "Wait for running units before exiting")
        long drainTimeoutMs;

        @Override
        public Integer call() throws Exception {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                if (pressure != null) {
                    runtime.setExternalPressure(pressure);
                }
                HttpServer server = metricsPort > 0 ? serve(runtime, metricsPort) : null;
                try {
                    if (cycles <= 0) {
                        runtime.start();
                        Thread.currentThread().join();
                        return 0;
                    }
                    long pause = intervalMs >= 0L ? intervalMs : runtime.currentSettings().cycleIntervalMs();
                    List<CycleReport> reports = new ArrayList<>();
                    for (int i = 0; i < cycles && !runtime.halted(); i++) {
                        reports.add(runtime.runCycle());
                        if (i + 1 < cycles && pause > 0L) {
                            Thread.sleep(pause);
                        }
                    }
                    boolean drained = runtime.awaitQuiescence(Duration.ofMillis(drainTimeoutMs));
                    runtime.flushTrace(Duration.ofSeconds(5));
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("cycles", reports);
                    out.put("drained", drained);
                    out.put("stats", runtime.stats());
                    System.out.println(Jsons.toJson(out));
                    return runtime.halted() ? 1 : 0;
                } finally {
                    if (server != null) {
                        server.stop(0);
                    }
                }
            }
        }

        private static HttpServer serve(ReactorMeshRuntime runtime, int port) throws IOException {
            HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/metrics", exchange -> {
                byte[] bytes = runtime.metricsText().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });
            server.createContext("/health", exchange -> {
                ReactorMeshRuntime.HealthOutcome health = runtime.health();
                byte[] bytes = Jsons.toJson(health).getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
                exchange.sendResponseHeaders(health.ok() ? 200 : 503, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });
            server.setExecutor(null);
            server.start();
            System.out.println("Metrics server listening on http://127.0.0.1:" + port + "/metrics");
            return server;
        }
    }

    @Command(name = "units", description = "List configured units with their state and counters")
    static final class UnitsCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.units()));
                return 0;
            }
        }
    }

    @Command(name = "acl-validate", description = "Validate an ACL manifest")
    static final class AclValidateCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--file"}, description = "Manifest path (defaults to <root>/acl.json)")
        String file;

        @Override
        public Integer call() {
            Path manifest = file == null ? parent.config().aclManifest() : Path.of(file);
            if (!Files.exists(manifest)) {
                System.out.println("ACL manifest not found: " + manifest);
                return 1;
            }
            List<String> problems = ReactorMeshRuntime.validateAcl(manifest);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("file", manifest.toString());
            out.put("valid", problems.isEmpty());
            out.put("problems", problems);
            System.out.println(Jsons.toJson(out));
            return problems.isEmpty() ? 0 : 1;
        }
    }

    @Command(name = "trace-tail", description = "Print the latest trace rows")
    static final class TraceTailCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                for (JsonNode row : runtime.traceTail(lines)) {
                    System.out.println(Jsons.toCompactJson(row));
                }
                return 0;
            }
        }
    }

    @Command(name = "trace-query", description = "Query trace rows by unit and kind")
    static final class TraceQueryCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--unit"}, description = "Filter by unit id")
        String unitId;

        @Option(names = {"--kind"}, description = "Filter by kind: mutation | evaluation | security | engine")
        String kind;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows, newest last")
        int limit;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.traceQuery(unitId, kind, limit)));
                return 0;
            }
        }
    }

    @Command(name = "trace-verify", description = "Verify the trace hash chain and signatures")
    static final class TraceVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                JsonlTraceSink.VerifyOutcome out = runtime.verifyTrace();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "trace-prune", description = "Archive trace rows older than the retention window")
    static final class TracePruneCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Option(names = {"--older-than-hours"}, defaultValue = "-1", description = "Cutoff age (-1 uses settings)")
        long olderThanHours;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                long hours = olderThanHours >= 0L ? olderThanHours : runtime.currentSettings().traceRetentionHours();
                Instant cutoff = Instant.now().minus(Duration.ofHours(hours));
                System.out.println(Jsons.toJson(runtime.pruneTrace(cutoff)));
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Show engine health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                ReactorMeshRuntime.HealthOutcome out = runtime.health();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "stats", description = "Show engine counters as JSON")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus text metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "settings", description = "Show effective engine settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ReactorMeshCommand parent;

        @Override
        public Integer call() {
            try (ReactorMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.reloadSettings()));
                return 0;
            }
        }
    }
}
