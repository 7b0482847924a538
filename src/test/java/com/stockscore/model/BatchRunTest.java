package com.stockscore.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchRunTest {

    @Test
    void snapshot_shouldListEveryRequestedEntityInOrder() {
        BatchRun run = new BatchRun("r", List.of("A", "B", "C"), Instant.EPOCH);
        run.record(ScoreResult.missingData("B"));

        List<BatchRun.Entry> entries = run.snapshot();

        assertEquals(3, entries.size());
        assertEquals("A", entries.get(0).entityId());
        assertEquals(BatchRun.EntryStatus.PENDING, entries.get(0).status());
        assertNull(entries.get(0).result());
        assertEquals(BatchRun.EntryStatus.FAILED, entries.get(1).status());
        assertEquals(BatchRun.EntryStatus.PENDING, entries.get(2).status());
        assertEquals(1, run.failed());
        assertEquals(2, run.pending());
    }

    @Test
    void snapshotOf_shouldIgnoreResultsOutsideRequestedList() {
        List<BatchRun.Entry> entries = BatchRun.snapshotOf(
                List.of("A"),
                Map.of("A", ScoreResult.missingData("A"), "Z", ScoreResult.missingData("Z"))
        );

        assertEquals(1, entries.size());
        assertEquals(BatchRun.EntryStatus.FAILED, entries.get(0).status());
    }

    @Test
    void constructor_shouldDropBlankAndDuplicateIdsKeepingFirstOccurrence() {
        BatchRun run = new BatchRun("r", List.of("B", "A", " B ", "", "A", "C"), Instant.EPOCH);

        assertEquals(List.of("B", "A", "C"), run.requested());
        assertEquals(3, run.total());
    }

    @Test
    void record_shouldRejectSecondAttemptForSameEntity() {
        BatchRun run = new BatchRun("r", List.of("A"), Instant.EPOCH);
        run.record(ScoreResult.missingData("A"));

        assertThrows(IllegalStateException.class, () -> run.record(ScoreResult.missingData("A")));
    }

    @Test
    void record_shouldRejectUnknownEntityAndFinalizedRun() {
        BatchRun run = new BatchRun("r", List.of("A"), Instant.EPOCH);

        assertThrows(IllegalArgumentException.class, () -> run.record(ScoreResult.missingData("Z")));

        run.finish(Instant.EPOCH.plusSeconds(5));
        assertTrue(run.isFinalized());
        assertThrows(IllegalStateException.class, () -> run.record(ScoreResult.missingData("A")));
    }

    @Test
    void coverage_shouldBeZeroForEmptyRun() {
        BatchRun empty = new BatchRun("r", List.of(), Instant.EPOCH);

        assertEquals(0.0, empty.coverage(), 1e-9);
    }

    @Test
    void coverage_shouldCountOnlySucceededEntities() {
        BatchRun run = new BatchRun("r", List.of("A", "B"), Instant.EPOCH);
        run.record(ScoreResult.ok("A", "", 1.0, 0.0, 5, 5, 5, 5, 5, 5.0, "Reduce", "red", "", List.of(), List.of(), ""));
        run.record(ScoreResult.missingData("B"));

        assertEquals(0.5, run.coverage(), 1e-9);
        assertEquals(1, run.succeeded());
        assertEquals(List.of("A", "B"), List.of(run.orderedResults().get(0).entityId, run.orderedResults().get(1).entityId));
    }
}
