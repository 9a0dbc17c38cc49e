package io.marketlake.marketdata.upstream;

import java.net.URI;

/** A sub-request could not be fetched. */
public class FetchException extends Exception {
    private final URI uri;
    private final int statusCode;

    public FetchException(URI uri, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
        this.statusCode = statusCode;
    }

    public URI uri() { return uri; }

    /** HTTP status of the failed response, or -1 when none was received. */
    public int statusCode() { return statusCode; }
}
