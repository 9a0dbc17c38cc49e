package io.marketlake.marketdata;

/** A request expanded into zero sub-requests, either because it covers no trading days or everything is stored. */
public class EmptyExpansionException extends IllegalArgumentException {
    public EmptyExpansionException(String message) { super(message); }
}
