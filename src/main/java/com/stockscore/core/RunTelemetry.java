package com.stockscore.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single run's step timings and outcome counters.
 */
public final class RunTelemetry {
    public static final String STEP_SCORE = "SCORE";
    public static final String STEP_PERSIST = "PERSIST";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String modelName;
    private final Instant startedAt;
    private Instant finishedAt;

    private int entitiesOk;
    private int entitiesFailed;
    private int entitiesMissing;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runId, String modelName, Instant startedAt) {
        this.runId = blankTo(runId, "unknown");
        this.modelName = blankTo(modelName, "unknown");
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

    public synchronized void endStep(String name, long itemsOut, long errorCount) {
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
        stat.calls++;
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        errorsTotal += (int) Math.max(0L, errorCount);
    }

    public synchronized void recordOk() {
        entitiesOk++;
    }

    public synchronized void recordFailed() {
        entitiesFailed++;
    }

    public synchronized void recordMissing() {
        entitiesMissing++;
    }

    public synchronized void finish(Instant at) {
        if (finishedAt == null) {
            finishedAt = at == null ? Instant.now() : at;
        }
    }

    public synchronized long elapsedMs(String step) {
        StepStat stat = steps.get(sanitizeStepName(step));
        return stat == null ? 0L : stat.elapsedMs;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        long totalMs = Math.max(0L, Duration.between(startedAt, end).toMillis());
        StringBuilder sb = new StringBuilder(512);
        sb.append("run_id=").append(runId).append("\n");
        sb.append("model=").append(modelName).append("\n");
        sb.append("started_at=").append(ISO.format(startedAt)).append("\n");
        sb.append("finished_at=").append(finishedAt == null ? "" : ISO.format(finishedAt)).append("\n");
        sb.append("total_elapsed_ms=").append(totalMs).append("\n");
        sb.append("entities_ok=").append(entitiesOk)
                .append(" entities_failed=").append(entitiesFailed)
                .append(" entities_missing=").append(entitiesMissing)
                .append(" errors_total=").append(errorsTotal)
                .append("\n");
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s calls=%d elapsed_ms=%d items_out=%d errors=%d%n",
                    stat.name,
                    stat.calls,
                    stat.elapsedMs,
                    stat.itemsOut,
                    stat.errorCount
            ));
        }
        return sb.toString();
    }

    private static String sanitizeStepName(String name) {
        String s = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        return s.isEmpty() ? "UNKNOWN" : s;
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }

    private static final class StepStat {
        private final String name;
        private long calls;
        private long elapsedMs;
        private long itemsOut;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }
}
