package io.marketlake.marketdata;

import java.util.UUID;

/** Writing a finalized job's partitions to the object store failed. */
public class CommitException extends RuntimeException {
    private final UUID jobId;

    public CommitException(UUID jobId, String key, Throwable cause) {
        super("Job " + jobId + " failed to commit " + key + ": " + cause.getMessage(), cause);
        this.jobId = jobId;
    }

    public UUID jobId() { return jobId; }
}
