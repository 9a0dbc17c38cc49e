package io.marketlake.marketdata;

/** A request's time range cannot be expanded: no start, end before start, or {@code all} on the write path. */
public class InvalidRangeException extends IllegalArgumentException {
    public InvalidRangeException(String message) { super(message); }
}
