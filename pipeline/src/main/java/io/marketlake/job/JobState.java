package io.marketlake.job;

/**
 * Lifecycle of a {@link Job}. OPEN is the only state that accepts completions; the other two are terminal.
 */
public enum JobState {
    OPEN,
    FINALIZED,
    ABORTED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
