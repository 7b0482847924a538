package com.stockscore.runner;

import com.stockscore.ai.HeartbeatInvoker;
import com.stockscore.ai.ModelService;
import com.stockscore.ai.PromptMessage;
import com.stockscore.model.ErrorKind;
import com.stockscore.model.Quote;
import com.stockscore.model.ScoreResult;
import com.stockscore.output.ProgressStore;
import com.stockscore.scoring.Scorer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchOrchestratorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T08:00:00Z"), ZoneOffset.UTC);
    private static final String GOOD = "{\"technical_score\": 7, \"fundamental_score\": 8, \"growth_score\": 6,"
            + " \"sentiment_score\": 5, \"industry_risk_score\": 4, \"reason\": \"ok\"}";

    @TempDir
    Path tempDir;

    @Test
    void run_shouldRecordMissingQuoteAndKeepGoing() throws Exception {
        AtomicReference<String> progressWhileScoringC = new AtomicReference<>();
        Path progress = tempDir.resolve("r1").resolve(ProgressStore.PROGRESS_FILE);
        ModelService model = (messages, temperature, timeout) -> {
            if (entityOf(messages).equals("C")) {
                progressWhileScoringC.set(Files.readString(progress, StandardCharsets.UTF_8));
            }
            return GOOD;
        };

        BatchOutcome outcome = orchestrator(model, 3, Duration.ofSeconds(5))
                .run("r1", List.of("A", "B", "C"), Map.of("A", Quote.of(10.0, 1.0), "C", Quote.of(20.0, -1.0)));

        assertEquals(List.of("A", "B", "C"), outcome.results.stream().map(r -> r.entityId).collect(Collectors.toList()));
        assertTrue(outcome.run.result("A").ok);
        assertFalse(outcome.run.result("B").ok);
        assertEquals(ErrorKind.MISSING_DATA, outcome.run.result("B").errorKind);
        assertTrue(outcome.run.result("B").error.contains("missing data"));
        assertTrue(outcome.run.result("C").ok);
        assertEquals(2, outcome.succeeded);
        assertEquals(3, outcome.total);
        assertEquals(2.0 / 3.0, outcome.coverage, 1e-9);

        String snapshot = progressWhileScoringC.get();
        assertNotNull(snapshot);
        assertTrue(snapshot.contains("| A | 10.00 |"));
        assertTrue(snapshot.contains("| B | N/A |"));
        assertTrue(snapshot.contains("| C | ... |"));

        String finalMd = Files.readString(progress, StandardCharsets.UTF_8);
        assertTrue(finalMd.contains("- Status: final"));
        assertTrue(finalMd.contains("| C | 20.00 |"));
        assertTrue(Files.exists(tempDir.resolve("r1").resolve(ProgressStore.SUMMARY_FILE)));
    }

    @Test
    void run_shouldContinueAfterProviderFailures() throws Exception {
        ModelService model = (messages, temperature, timeout) -> {
            if (entityOf(messages).equals("A")) {
                throw new IOException("connection refused");
            }
            return GOOD;
        };

        BatchOutcome outcome = orchestrator(model, 3, Duration.ofSeconds(5))
                .run("r2", List.of("A", "B"), Map.of("A", Quote.of(1.0, 0.0), "B", Quote.of(2.0, 0.0)));

        ScoreResult a = outcome.run.result("A");
        assertFalse(a.ok);
        assertEquals(ErrorKind.PROVIDER, a.errorKind);
        assertEquals(3, a.attempts);
        assertEquals(1.0, a.price, 1e-9);
        assertTrue(outcome.run.result("B").ok);
        assertEquals(1, outcome.succeeded);
    }

    @Test
    void run_shouldMoveOnFromHungEntityWithinBudget() {
        CountDownLatch release = new CountDownLatch(1);
        ModelService model = (messages, temperature, timeout) -> {
            if (entityOf(messages).equals("HANG")) {
                awaitIgnoringInterrupts(release);
            }
            return GOOD;
        };
        try {
            long started = System.nanoTime();
            BatchOutcome outcome = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> orchestrator(model, 1, Duration.ofMillis(200))
                    .run("r3", List.of("HANG", "OK"), Map.of("HANG", Quote.of(1.0, 0.0), "OK", Quote.of(2.0, 0.0))));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertEquals(ErrorKind.TIMEOUT, outcome.run.result("HANG").errorKind);
            assertTrue(outcome.run.result("OK").ok);
            assertTrue(elapsedMs < 200 + 3000, "took " + elapsedMs + "ms");
        } finally {
            release.countDown();
        }
    }

    @Test
    void run_shouldKeepLastSnapshotWhenInterrupted() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Thread runner = Thread.currentThread();
        ModelService model = (messages, temperature, timeout) -> {
            if (entityOf(messages).equals("B")) {
                runner.interrupt();
                awaitIgnoringInterrupts(release);
            }
            return GOOD;
        };
        try {
            assertThrows(InterruptedException.class, () -> orchestrator(model, 1, Duration.ofSeconds(30))
                    .run("r4", List.of("A", "B", "C"), Map.of("A", Quote.of(1.0, 0.0), "B", Quote.of(2.0, 0.0), "C", Quote.of(3.0, 0.0))));
        } finally {
            Thread.interrupted();
            release.countDown();
        }

        String md = Files.readString(tempDir.resolve("r4").resolve(ProgressStore.PROGRESS_FILE), StandardCharsets.UTF_8);
        assertTrue(md.contains("- Status: in progress"));
        assertTrue(md.contains("| A | 1.00 |"));
        assertTrue(md.contains("| B | ... |"));
        assertTrue(md.contains("| C | ... |"));
    }

    @Test
    void run_shouldIgnoreDuplicateIdsAndDefaultRunId() throws Exception {
        ModelService model = (messages, temperature, timeout) -> GOOD;

        BatchOutcome outcome = orchestrator(model, 1, Duration.ofSeconds(5))
                .run(List.of("A", "A", " ", "B"), Map.of("A", Quote.of(1.0, 0.0), "B", Quote.of(2.0, 0.0)));

        assertEquals(2, outcome.total);
        assertEquals("20261019_080000", outcome.run.runId());
        assertTrue(outcome.run.isFinalized());
        assertTrue(Files.exists(tempDir.resolve("20261019_080000").resolve(ProgressStore.PROGRESS_FILE)));
    }

    @Test
    void run_shouldFinishEmptyBatchWithZeroCoverage() throws Exception {
        BatchOutcome outcome = orchestrator((messages, temperature, timeout) -> GOOD, 1, Duration.ofSeconds(5))
                .run("r5", List.of(), Map.of());

        assertEquals(0, outcome.total);
        assertEquals(0.0, outcome.coverage, 1e-9);
    }

    @Test
    void run_shouldReturnOutcomeWhenFinalSnapshotCannotBeWritten() throws Exception {
        Path runDir = tempDir.resolve("r6");
        ModelService model = (messages, temperature, timeout) -> {
            if (entityOf(messages).equals("B")) {
                try (Stream<Path> paths = Files.walk(runDir)) {
                    for (Path p : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                        Files.delete(p);
                    }
                }
                Files.writeString(runDir, "not a directory", StandardCharsets.UTF_8);
            }
            return GOOD;
        };

        BatchOutcome outcome = orchestrator(model, 1, Duration.ofSeconds(5))
                .run("r6", List.of("A", "B"), Map.of("A", Quote.of(1.0, 0.0), "B", Quote.of(2.0, 0.0)));

        assertTrue(outcome.run.isFinalized());
        assertEquals(2, outcome.succeeded);
        assertTrue(outcome.run.result("B").ok);
        assertTrue(Files.isRegularFile(runDir));
    }

    @Test
    void run_shouldMatchQuotesWhoseKeysCarrySurroundingSpaces() throws Exception {
        BatchOutcome outcome = orchestrator((messages, temperature, timeout) -> GOOD, 1, Duration.ofSeconds(5))
                .run("r7", List.of("A"), Map.of(" A ", Quote.of(1.0, 0.0)));

        ScoreResult a = outcome.run.result("A");
        assertTrue(a.ok);
        assertEquals(1.0, a.price, 1e-9);
    }

    @Test
    void trimKeys_shouldKeepFirstQuoteForCollidingKeys() {
        Map<String, Quote> raw = new LinkedHashMap<>();
        raw.put("A", Quote.of(1.0, 0.0));
        raw.put(" A", Quote.of(2.0, 0.0));
        raw.put("  ", Quote.of(3.0, 0.0));

        Map<String, Quote> trimmed = BatchOrchestrator.trimKeys(raw);

        assertEquals(1, trimmed.size());
        assertEquals(1.0, trimmed.get("A").lastDone, 1e-9);
    }

    private BatchOrchestrator orchestrator(ModelService model, int maxAttempts, Duration timeout) {
        HeartbeatInvoker invoker = new HeartbeatInvoker(Duration.ofMillis(10), Duration.ZERO, timeout);
        Scorer scorer = new Scorer(model, invoker, 0.7, maxAttempts, 0L);
        return new BatchOrchestrator(scorer, new ProgressStore(tempDir, CLOCK), CLOCK, "fake");
    }

    private static String entityOf(List<PromptMessage> messages) {
        String user = messages.get(messages.size() - 1).content();
        int start = user.indexOf("Code: ") + "Code: ".length();
        return user.substring(start, user.indexOf('\n', start)).trim();
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (latch.getCount() > 0 && System.nanoTime() < deadline) {
            try {
                latch.await(50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ignored) {
                // keeps blocking like a transport that ignores cancellation
            }
        }
    }
}
