package io.marketlake.error;

/**
 * Receives work items that could not be completed, for later inspection or replay.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, T item, Throwable cause);

    @Override default void close() {}

    static <T> DeadLetterSink<T> discarding() {
        return (stage, item, cause) -> {};
    }
}
