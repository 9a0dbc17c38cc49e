package io.marketlake.job;

import java.util.UUID;

public class InvalidJobException extends JobContractException {
    public InvalidJobException(UUID jobId, String message) {
        super(jobId, message);
    }
}
