package io.marketlake.retry;

public interface RetryPolicy {
    /** Whether a call that failed on {@code attempt} (1-based) with {@code e} should be tried again. */
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0; }
        };
    }
}
