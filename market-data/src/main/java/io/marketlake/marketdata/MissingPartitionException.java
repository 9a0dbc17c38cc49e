package io.marketlake.marketdata;

public class MissingPartitionException extends RuntimeException {
    private final String key;

    public MissingPartitionException(String key) {
        super("No stored partition matches " + key);
        this.key = key;
    }

    /** The partition key or glob pattern that matched nothing. */
    public String key() { return key; }
}
