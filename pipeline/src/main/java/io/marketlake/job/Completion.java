package io.marketlake.job;

/**
 * Outcome handed back to a worker after it records a slot on a {@link Job}.
 */
public enum Completion {
    /** Slot stored; other slots are still outstanding. */
    RECORDED,
    /** Slot stored and it was the last one. The receiving caller owns finalization. */
    FINALIZE,
    /** The job was aborted; the value was discarded. */
    DROPPED;

    public boolean isFinalizer() {
        return this == FINALIZE;
    }
}
