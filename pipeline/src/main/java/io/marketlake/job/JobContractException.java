package io.marketlake.job;

import java.util.UUID;

/**
 * Base type for misuse of the job contract. These indicate a dispatcher bug rather than bad input or bad data.
 */
public class JobContractException extends IllegalStateException {
    private final UUID jobId;

    public JobContractException(UUID jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public UUID jobId() { return jobId; }
}
