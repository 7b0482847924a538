package com.stockscore.runner;

import com.stockscore.model.BatchRun;
import com.stockscore.model.ScoreResult;

import java.nio.file.Path;
import java.util.List;

public final class BatchOutcome {
    public final BatchRun run;
    public final List<ScoreResult> results;
    public final int succeeded;
    public final int total;
    public final double coverage;
    public final Path outputDir;

    BatchOutcome(BatchRun run, Path outputDir) {
        this.run = run;
        this.results = run.orderedResults();
        this.succeeded = run.succeeded();
        this.total = run.total();
        this.coverage = run.coverage();
        this.outputDir = outputDir;
    }
}
