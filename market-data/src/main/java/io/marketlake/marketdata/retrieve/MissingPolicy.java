package io.marketlake.marketdata.retrieve;

/** What retrieval does when a requested partition is not stored. */
public enum MissingPolicy {
    FAIL,
    SKIP
}
