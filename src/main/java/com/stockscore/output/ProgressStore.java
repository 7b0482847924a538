package com.stockscore.output;

import com.stockscore.model.BatchRun;
import com.stockscore.model.ScoreResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the per-run progress artifacts under {@code <root>/<runId>/}:
 * <ul>
 *     <li>{@code progress.md}, a table in request order, re-rendered after every entity</li>
 *     <li>{@code details/<entity>.json}, one record per completed entity, written once</li>
 *     <li>{@code summary.json}, written by {@link #persistFinal}</li>
 * </ul>
 * Every file goes through a temp file and an atomic rename so an interrupted
 * process leaves the previous snapshot readable.
 */
public final class ProgressStore {
    private static final Logger LOG = LogManager.getLogger(ProgressStore.class);
    private static final DateTimeFormatter DISPLAY_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    public static final String PROGRESS_FILE = "progress.md";
    public static final String SUMMARY_FILE = "summary.json";
    public static final String DETAILS_DIR = "details";

    static final String PENDING_CELL = "...";
    static final String PENDING_MARK = "pending";
    static final String FAILED_CELL = "N/A";
    static final String FAILED_MARK = "failed";

    private final Path rootDir;
    private final Clock clock;

    public ProgressStore(Path rootDir, Clock clock) {
        if (rootDir == null) {
            throw new IllegalArgumentException("rootDir must not be null");
        }
        this.rootDir = rootDir;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public Path runDir(String runId) {
        return rootDir.resolve(safeFileName(runId));
    }

    /**
     * Creates the run directory. Failure here aborts the whole run.
     */
    public Path open(String runId) {
        Path dir = runDir(runId);
        try {
            Files.createDirectories(dir.resolve(DETAILS_DIR));
            return dir;
        } catch (IOException | RuntimeException e) {
            throw new BatchFatalException("cannot create progress directory " + dir.toAbsolutePath(), e);
        }
    }

    public void persistPartial(String runId, List<String> requestedOrder, Map<String, ScoreResult> resultsSoFar) throws IOException {
        Path dir = open(runId);
        writeDetails(dir, requestedOrder, resultsSoFar);
        String body = renderHeader(runId, requestedOrder, resultsSoFar, false)
                + renderTable(requestedOrder, resultsSoFar);
        writeAtomically(dir.resolve(PROGRESS_FILE), body);
    }

    public void persistFinal(
            String runId,
            List<String> requestedOrder,
            Map<String, ScoreResult> results,
            String telemetrySummary
    ) throws IOException {
        Path dir = open(runId);
        writeDetails(dir, requestedOrder, results);
        String body = renderHeader(runId, requestedOrder, results, true)
                + renderTable(requestedOrder, results)
                + renderNarrative(requestedOrder, results)
                + renderFailures(requestedOrder, results);
        writeAtomically(dir.resolve(PROGRESS_FILE), body);
        writeAtomically(dir.resolve(SUMMARY_FILE), summaryJson(runId, requestedOrder, results, telemetrySummary).toString(2));
        LOG.info("final progress written dir={}", dir.toAbsolutePath());
    }

    String renderHeader(String runId, List<String> requested, Map<String, ScoreResult> results, boolean finalized) {
        int total = requested.size();
        int ok = 0;
        int failed = 0;
        int pending = 0;
        for (BatchRun.Entry entry : BatchRun.snapshotOf(requested, results)) {
            switch (entry.status()) {
                case OK:
                    ok++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    pending++;
            }
        }
        double pct = total == 0 ? 0.0 : ok * 100.0 / total;

        StringBuilder sb = new StringBuilder(256);
        sb.append("# Scoring progress\n\n");
        sb.append("- Run: ").append(runId).append("\n");
        sb.append("- Status: ").append(finalized ? "final" : "in progress").append("\n");
        sb.append("- Updated: ").append(clock.instant().atZone(zoneOf(clock)).format(DISPLAY_TS)).append("\n");
        sb.append("- Coverage: ").append(ok).append("/").append(total)
                .append(String.format(Locale.US, " (%.1f%%)", pct))
                .append(" pending=").append(pending)
                .append(" failed=").append(failed)
                .append("\n\n");
        return sb.toString();
    }

    static String renderTable(List<String> requested, Map<String, ScoreResult> results) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("| code | price | technical | fundamental | growth | overall | rating | signal |\n");
        sb.append("|---|---|---|---|---|---|---|---|\n");
        for (BatchRun.Entry entry : BatchRun.snapshotOf(requested, results)) {
            String id = entry.entityId();
            ScoreResult r = entry.result();
            if (entry.status() == BatchRun.EntryStatus.PENDING) {
                row(sb, id, PENDING_CELL, PENDING_CELL, PENDING_CELL, PENDING_CELL, PENDING_CELL, PENDING_CELL, PENDING_MARK);
            } else if (entry.status() == BatchRun.EntryStatus.FAILED) {
                row(sb, id, FAILED_CELL, FAILED_CELL, FAILED_CELL, FAILED_CELL, FAILED_CELL, FAILED_CELL, FAILED_MARK);
            } else {
                row(
                        sb,
                        id,
                        r.price == null ? "-" : fmt(r.price, 2),
                        fmt(r.technical, 1),
                        fmt(r.fundamental, 1),
                        fmt(r.growth, 1),
                        fmt(r.overallScore, 2),
                        r.rating,
                        r.signal
                );
            }
        }
        return sb.toString();
    }

    static String renderNarrative(List<String> requested, Map<String, ScoreResult> results) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("\n## Analysis details\n");
        boolean any = false;
        for (String id : requested) {
            ScoreResult r = results.get(id);
            if (r == null || !r.ok) {
                continue;
            }
            any = true;
            sb.append("\n### ").append(id);
            if (!r.displayName.equals(id)) {
                sb.append(" ").append(r.displayName);
            }
            sb.append("\n\n");
            sb.append("- Overall: ").append(fmt(r.overallScore, 2))
                    .append(" (").append(r.rating).append(" / ").append(r.signal).append(")\n");
            sb.append("- Reason: ").append(oneLine(r.reason)).append("\n");
            bulletList(sb, "Risks", r.risks);
            bulletList(sb, "Opportunities", r.opportunities);
            sb.append("- Suggestion: ").append(oneLine(r.suggestion)).append("\n");
        }
        if (!any) {
            sb.append("\nNo entity was scored successfully.\n");
        }
        return sb.toString();
    }

    static String renderFailures(List<String> requested, Map<String, ScoreResult> results) {
        StringBuilder sb = new StringBuilder(512);
        boolean header = false;
        for (String id : requested) {
            ScoreResult r = results.get(id);
            if (r == null || r.ok) {
                continue;
            }
            if (!header) {
                sb.append("\n## Failures\n\n");
                header = true;
            }
            sb.append("- ").append(id)
                    .append(" [").append(r.errorKind.name()).append("]: ")
                    .append(oneLine(r.error)).append("\n");
        }
        return sb.toString();
    }

    public static JSONObject toJson(ScoreResult r) {
        JSONObject o = new JSONObject();
        o.put("code", r.entityId);
        o.put("name", r.displayName);
        o.put("ok", r.ok);
        o.put("price", r.price == null ? JSONObject.NULL : r.price);
        o.put("change_pct", r.changePct == null ? JSONObject.NULL : r.changePct);
        if (r.ok) {
            o.put("technical_score", r.technical);
            o.put("fundamental_score", r.fundamental);
            o.put("growth_score", r.growth);
            o.put("sentiment_score", r.sentiment);
            o.put("industry_risk_score", r.industryRisk);
            o.put("overall_score", r.overallScore);
            o.put("rating", r.rating);
            o.put("signal", r.signal);
            o.put("reason", r.reason);
            o.put("risks", new JSONArray(r.risks));
            o.put("opportunities", new JSONArray(r.opportunities));
            o.put("suggestion", r.suggestion);
        } else {
            o.put("error", r.error);
            o.put("error_kind", r.errorKind.name());
        }
        o.put("attempts", r.attempts);
        return o;
    }

    private JSONObject summaryJson(String runId, List<String> requested, Map<String, ScoreResult> results, String telemetrySummary) {
        int ok = 0;
        JSONArray rows = new JSONArray();
        for (String id : requested) {
            ScoreResult r = results.get(id);
            if (r == null) {
                JSONObject pending = new JSONObject();
                pending.put("code", id);
                pending.put("ok", false);
                pending.put("error", "not attempted");
                rows.put(pending);
                continue;
            }
            if (r.ok) {
                ok++;
            }
            rows.put(toJson(r));
        }
        JSONObject root = new JSONObject();
        root.put("run_id", runId);
        root.put("generated_at", clock.instant().toString());
        root.put("requested", requested.size());
        root.put("succeeded", ok);
        root.put("coverage", requested.isEmpty() ? 0.0 : ok / (double) requested.size());
        root.put("results", rows);
        if (telemetrySummary != null && !telemetrySummary.isBlank()) {
            root.put("telemetry", telemetrySummary);
        }
        return root;
    }

    private void writeDetails(Path dir, List<String> requested, Map<String, ScoreResult> results) throws IOException {
        for (String id : requested) {
            ScoreResult r = results.get(id);
            if (r == null) {
                continue;
            }
            Path file = dir.resolve(DETAILS_DIR).resolve(safeFileName(id) + ".json");
            if (Files.exists(file)) {
                continue;
            }
            writeAtomically(file, toJson(r).toString(2));
        }
    }

    static void writeAtomically(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    // Rewritten names carry a hash of the original so "BRK/B" and "BRK_B" never share a file.
    static String safeFileName(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        String s = trimmed.replaceAll("[^A-Za-z0-9._-]", "_");
        if (s.equals(trimmed) && !s.isEmpty() && !s.startsWith(".")) {
            return s;
        }
        return (s.isEmpty() ? "_" : s) + "-" + Integer.toHexString(trimmed.hashCode());
    }

    private static void row(StringBuilder sb, String... cells) {
        sb.append("|");
        for (String cell : cells) {
            sb.append(" ").append(cell == null ? "" : cell.replace("|", "\\|")).append(" |");
        }
        sb.append("\n");
    }

    private static void bulletList(StringBuilder sb, String label, List<String> items) {
        sb.append("- ").append(label).append(":");
        if (items.isEmpty()) {
            sb.append(" none\n");
            return;
        }
        sb.append("\n");
        for (String item : items) {
            sb.append("  - ").append(oneLine(item)).append("\n");
        }
    }

    private static String oneLine(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r", " ").replace("\n", " ").trim();
    }

    private static String fmt(double value, int decimals) {
        return String.format(Locale.US, "%." + decimals + "f", value);
    }

    private static ZoneId zoneOf(Clock clock) {
        return clock.getZone() == null ? ZoneId.systemDefault() : clock.getZone();
    }
}
