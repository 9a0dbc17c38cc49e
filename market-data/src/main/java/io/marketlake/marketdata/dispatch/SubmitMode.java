package io.marketlake.marketdata.dispatch;

public enum SubmitMode {
    /** Return as soon as every sub-request is queued. */
    ASYNC,
    /** Return once the job has been committed, failed to commit, or been cancelled. */
    SYNC
}
