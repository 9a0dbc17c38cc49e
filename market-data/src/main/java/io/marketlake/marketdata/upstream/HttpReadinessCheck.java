package io.marketlake.marketdata.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Checks the provider terminal with a cheap listing call. Any answer other than 200 counts as not ready.
 */
public class HttpReadinessCheck implements ReadinessCheck {
    private static final Logger log = LoggerFactory.getLogger(HttpReadinessCheck.class);
    static final String LISTING_PATH = "/list/dates/stock/quote?root=AAPL";

    private final HttpClient http;
    private final URI listing;
    private final Duration timeout;

    public HttpReadinessCheck(HttpClient http, String upstreamUrl, Duration timeout) {
        this.http = http;
        String base = upstreamUrl.endsWith("/") ? upstreamUrl.substring(0, upstreamUrl.length() - 1) : upstreamUrl;
        this.listing = URI.create(base + LISTING_PATH);
        this.timeout = timeout;
    }

    @Override
    public boolean isReady() {
        HttpRequest req = HttpRequest.newBuilder(listing).timeout(timeout).GET().build();
        try {
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            if (resp.statusCode() != 200) {
                log.warn("Provider at {} answered the readiness check with {}", listing, resp.statusCode());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Provider at {} is unreachable: {}", listing, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
