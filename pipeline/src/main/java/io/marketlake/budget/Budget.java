package io.marketlake.budget;

/**
 * Governs how fast the process may call the external data provider.
 */
public interface Budget {
    /** Block as needed to respect the external QPS budget (one op). */
    void acquireExternalOp() throws InterruptedException;

    /** Non-blocking variant; true when a permit was taken. */
    boolean tryAcquireExternalOp();

    static Budget unlimited() {
        return new Budget() {
            @Override public void acquireExternalOp() {}
            @Override public boolean tryAcquireExternalOp() { return true; }
        };
    }
}
