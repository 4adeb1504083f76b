package io.reactormesh.observability;

import java.util.LinkedHashMap;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(EngineStats stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "reactormesh_halted", "Reactor halted after mesh corruption (1=yes,0=no)", null, null, stats.halted() ? 1L : 0L);
        appendGauge(sb, "reactormesh_commit_seq", "Latest mesh commit sequence", null, null, stats.commitSeq());
        appendGauge(sb, "reactormesh_mesh_entries", "Keys currently held by the mesh", null, null, stats.meshEntries());
        appendGauge(sb, "reactormesh_commits_total", "Successful mesh commits", null, null, stats.commits());
        appendGauge(sb, "reactormesh_keys_written_total", "Keys written by successful commits", null, null, stats.keysWritten());
        appendGauge(sb, "reactormesh_version_conflicts_total", "Commits rejected with a version conflict", null, null, stats.versionConflicts());
        appendGauge(sb, "reactormesh_commit_retries_total", "Commits retried after racing an unrelated commit", null, null, stats.commitRetries());
        appendGauge(sb, "reactormesh_backend_failures_total", "Mesh backend append failures", "backend", stats.backend(), stats.backendFailures());
        appendGauge(sb, "reactormesh_backend_backlog", "Commit batches waiting for the mesh backend", "backend", stats.backend(), stats.backendBacklog());

        appendDouble(sb, "reactormesh_pressure", "Effective pressure level (0-1)", null, null, stats.pressure());
        appendDouble(sb, "reactormesh_external_pressure", "Externally supplied pressure signal (0-1)", null, null, stats.externalPressure());
        appendGauge(sb, "reactormesh_throttle_mode", "Current throttle mode", "mode", stats.throttleMode(), 1L);
        appendGauge(sb, "reactormesh_admission_budget", "Admissions allowed in the current interval", null, null, stats.admissionBudget());
        appendGauge(sb, "reactormesh_admitted_in_window", "Admissions used in the current interval", null, null, stats.admittedInWindow());
        appendDouble(sb, "reactormesh_mutation_rate", "Mutations per second over the last sample interval", null, null, stats.mutationRatePerSecond());
        appendGauge(sb, "reactormesh_mutations_total", "Keys mutated since start", null, null, stats.mutationsTotal());

        appendGauge(sb, "reactormesh_cycles_total", "Reactor cycles run", null, null, stats.cycles());
        Map<String, Long> outcomes = new LinkedHashMap<>();
        outcomes.put("admitted", stats.admitted());
        outcomes.put("queued", stats.queued());
        outcomes.put("suppressed", stats.suppressed());
        outcomes.put("deferred", stats.deferred());
        outcomes.put("success", stats.succeeded());
        outcomes.put("failed", stats.failed());
        outcomes.put("timeout", stats.timeouts());
        outcomes.put("quarantined", stats.quarantined());
        outcomes.put("interrupt", stats.interrupts());
        appendMapGauge(sb, "reactormesh_scheduler_events_total", "Scheduler decisions grouped by kind", "event", outcomes);
        appendGauge(sb, "reactormesh_security_events_total", "Denied mesh accesses", null, null, stats.securityEvents());

        appendGauge(sb, "reactormesh_ingest_total", "Ingest submissions grouped by result", "result", "accepted", stats.ingestAccepted());
        appendGauge(sb, "reactormesh_ingest_total", "Ingest submissions grouped by result", "result", "conflict", stats.ingestConflicts());
        appendGauge(sb, "reactormesh_ingest_total", "Ingest submissions grouped by result", "result", "rejected", stats.ingestRejected());

        appendGauge(sb, "reactormesh_units", "Registered units grouped by state", "state", "registered", stats.unitsRegistered());
        appendGauge(sb, "reactormesh_units", "Registered units grouped by state", "state", "enabled", stats.unitsEnabled());
        appendGauge(sb, "reactormesh_units", "Registered units grouped by state", "state", "running", stats.unitsRunning());
        Map<String, Long> depths = new LinkedHashMap<>();
        stats.mutexQueueDepth().forEach((group, depth) -> depths.put(group, depth.longValue()));
        appendMapGauge(sb, "reactormesh_mutex_queue_depth", "Units waiting per mutex group", "group", depths);

        appendGauge(sb, "reactormesh_trace_sink_available", "Trace sink accepting writes (1=yes,0=no)", "sink", stats.traceSink(), stats.traceSinkAvailable() ? 1L : 0L);
        appendGauge(sb, "reactormesh_trace_records_total", "Trace records grouped by fate", "fate", "written", stats.traceWritten());
        appendGauge(sb, "reactormesh_trace_records_total", "Trace records grouped by fate", "fate", "dropped", stats.traceDropped());
        appendGauge(sb, "reactormesh_trace_records_total", "Trace records grouped by fate", "fate", "sampled_out", stats.traceSampledOut());
        appendGauge(sb, "reactormesh_trace_buffered", "Trace records waiting for the sink", null, null, stats.traceBuffered());
        appendGauge(sb, "reactormesh_trace_failed_writes_total", "Failed trace sink writes", null, null, stats.traceFailedWrites());

        for (UnitCounters unit : stats.units()) {
            appendUnit(sb, unit, "success", unit.success());
            appendUnit(sb, unit, "failed", unit.failed());
            appendUnit(sb, unit, "suppressed", unit.suppressed());
            appendUnit(sb, unit, "deferred", unit.deferred());
            appendUnit(sb, unit, "quarantined", unit.quarantined());
            appendUnit(sb, unit, "timeout", unit.timeouts());
        }
        for (UnitCounters unit : stats.units()) {
            appendGauge(sb, "reactormesh_unit_enabled", "Unit enabled flag (1=yes,0=no)", "unit", unit.unitId(), unit.enabled() ? 1L : 0L);
        }
        return sb.toString();
    }

    private static void appendUnit(StringBuilder sb, UnitCounters unit, String outcome, long value) {
        appendHeader(sb, "reactormesh_unit_outcomes_total", "Per-unit execution outcomes");
        sb.append("reactormesh_unit_outcomes_total{unit=\"").append(escapeLabel(unit.unitId()))
                .append("\",outcome=\"").append(outcome).append("\"} ").append(value).append('\n');
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        appendHeader(sb, metric, help);
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        appendSample(sb, metric, label, labelValue);
        sb.append(' ').append(value).append('\n');
    }

    private static void appendDouble(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendHeader(sb, metric, help);
        appendSample(sb, metric, label, labelValue);
        sb.append(' ').append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (sb.indexOf("# HELP " + metric + " ") >= 0) {
            return;
        }
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
    }

    private static void appendSample(StringBuilder sb, String metric, String label, String labelValue) {
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
