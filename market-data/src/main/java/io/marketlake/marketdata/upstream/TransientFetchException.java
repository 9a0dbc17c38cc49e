package io.marketlake.marketdata.upstream;

import java.net.URI;

/** Throttling, a server error or a dropped connection. Worth retrying. */
public class TransientFetchException extends FetchException {
    public TransientFetchException(URI uri, int statusCode, String message, Throwable cause) {
        super(uri, statusCode, message, cause);
    }
}
