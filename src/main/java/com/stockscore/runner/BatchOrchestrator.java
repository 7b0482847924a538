package com.stockscore.runner;

import com.stockscore.core.RunTelemetry;
import com.stockscore.model.BatchRun;
import com.stockscore.model.ErrorKind;
import com.stockscore.model.Quote;
import com.stockscore.model.ScoreResult;
import com.stockscore.output.ProgressStore;
import com.stockscore.scoring.ScoreException;
import com.stockscore.scoring.Scorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores the requested entities one at a time, in input order, and refreshes the
 * progress snapshot after each of them. A failing entity becomes a failed
 * placeholder; it never stops the batch.
 */
public final class BatchOrchestrator {
    private static final Logger LOG = LogManager.getLogger(BatchOrchestrator.class);
    private static final DateTimeFormatter RUN_ID_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Scorer scorer;
    private final ProgressStore store;
    private final Clock clock;
    private final String modelName;

    public BatchOrchestrator(Scorer scorer, ProgressStore store, Clock clock, String modelName) {
        if (scorer == null || store == null) {
            throw new IllegalArgumentException("scorer and store are required");
        }
        this.scorer = scorer;
        this.store = store;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.modelName = modelName == null ? "" : modelName;
    }

    public BatchOutcome run(List<String> requested, Map<String, Quote> quotes) throws InterruptedException {
        return run(null, requested, quotes);
    }

    /**
     * @throws com.stockscore.output.BatchFatalException when the progress directory cannot be created
     * @throws InterruptedException when the run is cancelled; the last partial snapshot stays on disk
     */
    public BatchOutcome run(String runId, List<String> requested, Map<String, Quote> quotes) throws InterruptedException {
        String id = runId == null || runId.isBlank()
                ? clock.instant().atZone(clock.getZone()).format(RUN_ID_FMT)
                : runId.trim();
        BatchRun run = new BatchRun(id, requested, clock.instant());
        int rawCount = requested == null ? 0 : requested.size();
        if (run.total() != rawCount) {
            LOG.warn("ignored {} blank or duplicate entity ids run_id={}", rawCount - run.total(), id);
        }
        Map<String, Quote> quoteMap = trimKeys(quotes);
        RunTelemetry telemetry = new RunTelemetry(id, modelName, run.startedAt());

        Path outputDir = store.open(id);
        LOG.info("batch started run_id={} entities={} output={}", id, run.total(), outputDir.toAbsolutePath());
        persistPartial(run, telemetry);

        int index = 0;
        for (String entityId : run.requested()) {
            index++;
            ScoreResult result = scoreEntity(entityId, quoteMap.get(entityId), telemetry);
            run.record(result);
            logEntity(index, run, result);
            persistPartial(run, telemetry);
        }

        run.finish(clock.instant());
        telemetry.finish(run.finishedAt());
        telemetry.startStep(RunTelemetry.STEP_PERSIST);
        try {
            store.persistFinal(id, run.requested(), run.results(), telemetry.getSummary());
            telemetry.endStep(RunTelemetry.STEP_PERSIST, 1, 0);
        } catch (IOException | RuntimeException e) {
            telemetry.endStep(RunTelemetry.STEP_PERSIST, 0, 1);
            LOG.warn("failed to persist final snapshot run_id={} err={}", id, e.getMessage());
        }

        BatchOutcome outcome = new BatchOutcome(run, outputDir);
        LOG.info(String.format(
                Locale.US,
                "batch finished run_id=%s coverage=%d/%d (%.1f%%) failed=%d",
                id,
                outcome.succeeded,
                outcome.total,
                outcome.coverage * 100.0,
                run.failed()
        ));
        LOG.info("telemetry\n{}", telemetry.getSummary());
        return outcome;
    }

    private ScoreResult scoreEntity(String entityId, Quote quote, RunTelemetry telemetry) throws InterruptedException {
        if (quote == null) {
            telemetry.recordMissing();
            return ScoreResult.missingData(entityId);
        }
        telemetry.startStep(RunTelemetry.STEP_SCORE);
        try {
            ScoreResult result = scorer.scoreOne(entityId, quote);
            telemetry.endStep(RunTelemetry.STEP_SCORE, 1, 0);
            telemetry.recordOk();
            return result;
        } catch (ScoreException e) {
            telemetry.endStep(RunTelemetry.STEP_SCORE, 0, 1);
            telemetry.recordFailed();
            return ScoreResult.failed(entityId, quote, e.kind(), e.getMessage(), e.attempts());
        } catch (RuntimeException e) {
            telemetry.endStep(RunTelemetry.STEP_SCORE, 0, 1);
            telemetry.recordFailed();
            LOG.error("unexpected failure scoring {}", entityId, e);
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
            return ScoreResult.failed(entityId, quote, ErrorKind.UNEXPECTED, msg, 0);
        }
    }

    private void persistPartial(BatchRun run, RunTelemetry telemetry) {
        telemetry.startStep(RunTelemetry.STEP_PERSIST);
        try {
            store.persistPartial(run.runId(), run.requested(), run.results());
            telemetry.endStep(RunTelemetry.STEP_PERSIST, 1, 0);
        } catch (IOException | RuntimeException e) {
            telemetry.endStep(RunTelemetry.STEP_PERSIST, 0, 1);
            LOG.warn("failed to persist progress run_id={} err={}", run.runId(), e.getMessage());
        }
    }

    // Entity ids are trimmed by BatchRun, so quote keys are trimmed the same way; the first key wins.
    static Map<String, Quote> trimKeys(Map<String, Quote> quotes) {
        Map<String, Quote> out = new LinkedHashMap<>();
        if (quotes == null) {
            return out;
        }
        for (Map.Entry<String, Quote> e : quotes.entrySet()) {
            if (e.getKey() != null && !e.getKey().isBlank()) {
                out.putIfAbsent(e.getKey().trim(), e.getValue());
            }
        }
        return out;
    }

    private static void logEntity(int index, BatchRun run, ScoreResult r) {
        if (r.ok) {
            LOG.info(String.format(
                    Locale.US,
                    "[%d/%d] %s overall=%.2f rating=%s signal=%s attempts=%d pending=%d",
                    index,
                    run.total(),
                    r.entityId,
                    r.overallScore,
                    r.rating,
                    r.signal,
                    r.attempts,
                    run.pending()
            ));
        } else {
            LOG.warn("[{}/{}] {} failed kind={} err={} failed_so_far={} pending={}",
                    index, run.total(), r.entityId, r.errorKind, r.error, run.failed(), run.pending());
        }
    }
}
