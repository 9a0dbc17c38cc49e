package io.marketlake.job;

import java.util.UUID;

public class JobAlreadyFinalizedException extends JobContractException {
    public JobAlreadyFinalizedException(UUID jobId, int slot) {
        super(jobId, "job " + jobId + " is already finalized; rejected completion for slot " + slot);
    }
}
