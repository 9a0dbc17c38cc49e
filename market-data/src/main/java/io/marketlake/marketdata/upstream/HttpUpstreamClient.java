package io.marketlake.marketdata.upstream;

import io.marketlake.budget.Budget;
import io.marketlake.marketdata.ContentType;
import io.marketlake.marketdata.Leg;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.SubRequest;
import io.marketlake.metrics.Metrics;
import io.marketlake.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Fetches sub-requests over HTTP. Each attempt takes a permit from the external-call budget. Throttling, 5xx and
 * I/O errors are retried per the retry policy and become permanent once it gives up; timeouts and other client
 * errors are permanent at once. The provider's 472 "no data" answer is a normal, empty payload.
 */
public class HttpUpstreamClient implements UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClient.class);
    static final int NO_DATA_STATUS = 472;
    static final String NO_DATA_MARKER = "No data for the specified timeframe";

    private final HttpClient http;
    private final Duration timeout;
    private final Budget budget;
    private final RetryPolicy retry;
    private final Metrics metrics;

    public HttpUpstreamClient(HttpClient http, Duration timeout, Budget budget, RetryPolicy retry, Metrics metrics) {
        this.http = http;
        this.timeout = timeout;
        this.budget = budget == null ? Budget.unlimited() : budget;
        this.retry = retry == null ? RetryPolicy.never() : retry;
        this.metrics = metrics;
    }

    @Override
    public RawPayload fetch(SubRequest request) throws FetchException {
        URI uri = request.uri();
        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(timeout).GET();
        for (Map.Entry<String, String> h : request.headers().entrySet()) b.header(h.getKey(), h.getValue());
        HttpRequest req = b.build();
        ContentType type = ContentType.forKind(request.kind());
        Leg leg = request.leg();

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return attempt(req, type, leg);
            } catch (TransientFetchException e) {
                if (!retry.shouldRetry(attempt, e)) {
                    throw new PermanentFetchException(uri, e.statusCode(),
                            "Gave up on " + uri + " after " + attempt + " attempt(s): " + e.getMessage(), e);
                }
                long backoff = retry.backoffMillis(attempt);
                log.debug("Attempt {} for {} failed ({}), retrying in {}ms", attempt, uri, e.getMessage(), backoff);
                if (metrics != null) metrics.counter("upstream.retries").inc();
                sleep(uri, backoff);
            }
        }
    }

    private RawPayload attempt(HttpRequest req, ContentType type, Leg leg) throws FetchException {
        URI uri = req.uri();
        HttpResponse<byte[]> resp;
        try {
            budget.acquireExternalOp();
            resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new PermanentFetchException(uri, -1, "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientFetchException(uri, -1, "I/O error: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentFetchException(uri, -1, "Interrupted", e);
        }

        int status = resp.statusCode();
        if (status == 200) return RawPayload.of(resp.body(), type, uri, leg);
        String body = resp.body() == null ? "" : new String(resp.body(), StandardCharsets.UTF_8);
        if (status == NO_DATA_STATUS && body.contains(NO_DATA_MARKER)) {
            log.debug("No data at {}", uri);
            return RawPayload.noData(type, uri, leg);
        }
        String message = "HTTP " + status + (body.isBlank() ? "" : ": " + abbreviate(body));
        if (status == 429 || status >= 500) throw new TransientFetchException(uri, status, message, null);
        throw new PermanentFetchException(uri, status, message, null);
    }

    private static void sleep(URI uri, long millis) throws PermanentFetchException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentFetchException(uri, -1, "Interrupted during backoff", e);
        }
    }

    private static String abbreviate(String s) {
        String t = s.strip();
        return t.length() <= 200 ? t : t.substring(0, 200) + "...";
    }
}
