package io.marketlake.job;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time view of a job's progress, taken under the job's lock.
 */
public record JobSnapshot(UUID jobId,
                          int completedParts,
                          int totalParts,
                          int failedParts,
                          JobState state,
                          Instant createdAt,
                          Instant updatedAt) {

    public boolean isFinalized() { return state == JobState.FINALIZED; }
    public boolean isAborted() { return state == JobState.ABORTED; }

    public double progressPercentage() {
        if (totalParts <= 0) return 0.0;
        return (100.0 * completedParts) / totalParts;
    }
}
