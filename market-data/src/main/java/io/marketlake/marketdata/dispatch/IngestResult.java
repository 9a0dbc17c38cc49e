package io.marketlake.marketdata.dispatch;

import io.marketlake.job.JobState;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a finalized ingest job. {@code skippedKeys} were already stored and not fetched;
 * {@code emptyKeys} had every slot fail and were not written.
 */
public record IngestResult(UUID jobId,
                           JobState state,
                           int totalParts,
                           long rowsWritten,
                           List<FailedSlot> failedSlots,
                           List<String> committedKeys,
                           List<String> skippedKeys,
                           List<String> emptyKeys) {
    public IngestResult {
        failedSlots = List.copyOf(failedSlots);
        committedKeys = List.copyOf(committedKeys);
        skippedKeys = List.copyOf(skippedKeys);
        emptyKeys = List.copyOf(emptyKeys);
    }

    public boolean hasFailures() { return !failedSlots.isEmpty(); }

    public String summary() {
        return "job " + jobId + " " + state + ": " + (totalParts - failedSlots.size()) + "/" + totalParts
                + " parts ok, " + rowsWritten + " rows in " + committedKeys.size() + " partition(s)"
                + (skippedKeys.isEmpty() ? "" : ", " + skippedKeys.size() + " already stored")
                + (failedSlots.isEmpty() ? "" : ", " + failedSlots.size() + " failed slot(s)");
    }
}
