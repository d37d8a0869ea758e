package com.talentscout.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single pipeline run's step timings and counters, rendered as a log summary.
 */
public final class RunTelemetry {
    public static final String STEP_VALIDATE = "VALIDATE";
    public static final String STEP_COLLECT = "COLLECT";
    public static final String STEP_SCORE = "SCORE";
    public static final String STEP_ASSEMBLE = "ASSEMBLE";
    public static final String STEP_SINK = "SINK";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private int recordsRaw;
    private int profilesDeduplicated;
    private int candidatesReturned;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();
    private final Map<String, SourceStat> sources = new LinkedHashMap<>();

    public RunTelemetry(String runId, String trigger, Instant startedAt) {
        this.runId = blankTo(runId, "run");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        stat.appendNote(note);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    /**
     * Records how one source finished. {@code status} is the failure label, or "ok".
     */
    public synchronized void recordSource(String source, long elapsedMs, int records, String status) {
        String key = blankTo(source, "unknown").toLowerCase(Locale.ROOT);
        sources.put(key, new SourceStat(key, Math.max(0L, elapsedMs), Math.max(0, records), blankTo(status, "ok")));
    }

    public synchronized void setCounts(int raw, int deduplicated, int returned) {
        this.recordsRaw = Math.max(0, raw);
        this.profilesDeduplicated = Math.max(0, deduplicated);
        this.candidatesReturned = Math.max(0, returned);
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("records_raw=").append(recordsRaw).append('\n');
        sb.append("profiles_dedup=").append(profilesDeduplicated).append('\n');
        sb.append("candidates_returned=").append(candidatesReturned).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("sources:\n");
        for (SourceStat stat : sources.values()) {
            sb.append(String.format(Locale.US, "  %s elapsed_ms=%d records=%d status=%s",
                    stat.name, stat.elapsedMs, stat.records, stat.status)).append('\n');
        }
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.note.isBlank()) {
                sb.append(" note=").append(stat.note);
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }

        private void appendNote(String extra) {
            String text = extra == null ? "" : extra.trim();
            if (text.isEmpty()) {
                return;
            }
            if (note.isEmpty()) {
                note = text;
            } else if (!note.contains(text)) {
                note = note + "; " + text;
            }
        }
    }

    private record SourceStat(String name, long elapsedMs, int records, String status) {
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String note
    ) {
    }
}
