package io.marketlake.job;

import java.util.UUID;

public class DuplicateSlotException extends JobContractException {
    private final int slot;

    public DuplicateSlotException(UUID jobId, int slot) {
        super(jobId, "slot " + slot + " of job " + jobId + " was already recorded");
        this.slot = slot;
    }

    public int slot() { return slot; }
}
