package io.marketlake.job;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JobTrackerTest {

    @Test
    void snapshots_survive_retirement() {
        JobTracker<String> tracker = new JobTracker<>();
        Job<String> job = tracker.create(2);
        assertEquals(1, tracker.liveCount());
        tracker.recordCompletion(job, 0, "a");
        assertEquals(1, tracker.snapshot(job.id()).orElseThrow().completedParts());
        assertEquals(Completion.FINALIZE, tracker.recordCompletion(job, 1, "b"));

        tracker.retire(job);
        assertEquals(0, tracker.liveCount());
        JobSnapshot s = tracker.snapshot(job.id()).orElseThrow();
        assertTrue(s.isFinalized());
        assertEquals(2, s.totalParts());
    }

    @Test
    void open_jobs_cannot_be_retired() {
        JobTracker<String> tracker = new JobTracker<>();
        Job<String> job = tracker.create(3);
        assertThrows(InvalidJobException.class, () -> tracker.retire(job));
        assertTrue(tracker.abort(job));
        tracker.retire(job);
        assertEquals(JobState.ABORTED, tracker.snapshot(job.id()).orElseThrow().state());
    }

    @Test
    void rejects_bad_part_counts_and_duplicate_ids() {
        JobTracker<String> tracker = new JobTracker<>();
        assertThrows(InvalidJobException.class, () -> tracker.create(0));
        UUID id = UUID.randomUUID();
        tracker.create(id, 1);
        assertThrows(InvalidJobException.class, () -> tracker.create(id, 1));
    }

    @Test
    void unknown_ids_are_empty() {
        assertTrue(new JobTracker<String>().snapshot(UUID.randomUUID()).isEmpty());
    }

    @Test
    void retired_snapshots_are_bounded() {
        JobTracker<String> tracker = new JobTracker<>(2);
        Job<String> first = tracker.create(1);
        tracker.recordCompletion(first, 0, "x");
        tracker.retire(first);
        for (int i = 0; i < 2; i++) {
            Job<String> j = tracker.create(1);
            tracker.recordCompletion(j, 0, "x");
            tracker.retire(j);
        }
        assertTrue(tracker.snapshot(first.id()).isEmpty());
    }
}
