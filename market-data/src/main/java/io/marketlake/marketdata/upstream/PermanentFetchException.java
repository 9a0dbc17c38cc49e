package io.marketlake.marketdata.upstream;

import java.net.URI;

/** The request will not succeed as sent, or retries have been exhausted. */
public class PermanentFetchException extends FetchException {
    public PermanentFetchException(URI uri, int statusCode, String message, Throwable cause) {
        super(uri, statusCode, message, cause);
    }
}
