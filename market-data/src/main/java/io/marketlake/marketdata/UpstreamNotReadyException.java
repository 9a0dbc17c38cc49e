package io.marketlake.marketdata;

public class UpstreamNotReadyException extends IllegalStateException {
    public UpstreamNotReadyException(String message) { super(message); }
}
