package com.stockscore.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * One execution of the scoring pipeline over a fixed, ordered entity list.
 * Observers always see exactly one entry per requested entity, in request order.
 */
public final class BatchRun {
    public enum EntryStatus {
        PENDING,
        OK,
        FAILED
    }

    public record Entry(String entityId, EntryStatus status, ScoreResult result) {
    }

    private final String runId;
    private final List<String> requested;
    private final Instant startedAt;
    private final Map<String, ScoreResult> results = new LinkedHashMap<>();
    private Instant finishedAt;

    public BatchRun(String runId, List<String> requested, Instant startedAt) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be empty");
        }
        this.runId = runId.trim();
        this.requested = dedupe(requested);
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public String runId() {
        return runId;
    }

    public List<String> requested() {
        return requested;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized boolean isFinalized() {
        return finishedAt != null;
    }

    public synchronized void record(ScoreResult result) {
        if (finishedAt != null) {
            throw new IllegalStateException("run " + runId + " is already finalized");
        }
        if (result == null || !requested.contains(result.entityId)) {
            throw new IllegalArgumentException("result does not belong to run " + runId);
        }
        if (results.containsKey(result.entityId)) {
            throw new IllegalStateException("entity already attempted: " + result.entityId);
        }
        results.put(result.entityId, result);
    }

    public synchronized void finish(Instant at) {
        if (finishedAt == null) {
            finishedAt = at == null ? Instant.now() : at;
        }
    }

    public synchronized ScoreResult result(String entityId) {
        return results.get(entityId);
    }

    public synchronized Map<String, ScoreResult> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public synchronized List<Entry> snapshot() {
        return snapshotOf(requested, results);
    }

    /**
     * One entry per requested id, in request order; ids without a result are pending.
     */
    public static List<Entry> snapshotOf(List<String> requested, Map<String, ScoreResult> results) {
        List<Entry> out = new ArrayList<>(requested.size());
        for (String id : requested) {
            ScoreResult r = results.get(id);
            if (r == null) {
                out.add(new Entry(id, EntryStatus.PENDING, null));
            } else {
                out.add(new Entry(id, r.ok ? EntryStatus.OK : EntryStatus.FAILED, r));
            }
        }
        return out;
    }

    public synchronized List<ScoreResult> orderedResults() {
        List<ScoreResult> out = new ArrayList<>(results.size());
        for (String id : requested) {
            ScoreResult r = results.get(id);
            if (r != null) {
                out.add(r);
            }
        }
        return out;
    }

    public synchronized int succeeded() {
        int n = 0;
        for (ScoreResult r : results.values()) {
            if (r.ok) {
                n++;
            }
        }
        return n;
    }

    public synchronized int failed() {
        return results.size() - succeeded();
    }

    public synchronized int pending() {
        return requested.size() - results.size();
    }

    public int total() {
        return requested.size();
    }

    public synchronized double coverage() {
        if (requested.isEmpty()) {
            return 0.0;
        }
        return succeeded() / (double) requested.size();
    }

    static List<String> dedupe(List<String> raw) {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        if (raw != null) {
            for (String id : raw) {
                if (id != null && !id.isBlank()) {
                    ids.add(id.trim());
                }
            }
        }
        return List.copyOf(ids);
    }
}
