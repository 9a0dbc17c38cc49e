package io.marketlake.marketdata.upstream;

import com.codahale.metrics.MetricRegistry;
import com.sun.net.httpserver.HttpServer;
import io.marketlake.budget.Budget;
import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.FileGranularity;
import io.marketlake.marketdata.Leg;
import io.marketlake.marketdata.PartitionKey;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.SubRequest;
import io.marketlake.metrics.Metrics;
import io.marketlake.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class HttpUpstreamClientTest {
    HttpServer server;
    final AtomicInteger flakyHits = new AtomicInteger();
    final AtomicInteger downHits = new AtomicInteger();
    final AtomicInteger missingHits = new AtomicInteger();
    volatile String lastUserAgent;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v2/ok", ex -> {
            lastUserAgent = ex.getRequestHeaders().getFirst("User-Agent");
            respond(ex, 200, "ms_of_day\n1\n");
        });
        server.createContext("/v2/nodata", ex -> respond(ex, 472, ":No data for the specified timeframe & contract."));
        server.createContext("/v2/flaky", ex -> {
            if (flakyHits.incrementAndGet() < 3) respond(ex, 503, "busy");
            else respond(ex, 200, "ok");
        });
        server.createContext("/v2/down", ex -> {
            downHits.incrementAndGet();
            respond(ex, 500, "boom");
        });
        server.createContext("/v2/missing", ex -> {
            missingHits.incrementAndGet();
            respond(ex, 404, "not found");
        });
        server.createContext("/v2/slow", ex -> {
            try { Thread.sleep(2_000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
            respond(ex, 200, "late");
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange ex, int status, String body) throws java.io.IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
    }

    private SubRequest sub(String path) {
        return sub(path, Leg.SINGLE);
    }

    private SubRequest sub(String path, Leg leg) {
        URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/v2/" + path + "?root=SPY");
        PartitionKey key = PartitionKey.monthly(DatasetKind.STOCK_EOD, "SPY", "1d", java.time.YearMonth.of(2024, 1));
        return new SubRequest(uri, Map.of("User-Agent", "market-lake-test"), DatasetKind.STOCK_EOD, key, 0, LocalDate.of(2024, 1, 2), leg);
    }

    private HttpUpstreamClient client(MetricRegistry registry, Duration timeout) {
        return new HttpUpstreamClient(HttpClient.newHttpClient(), timeout, Budget.unlimited(),
                new ExponentialBackoffRetryPolicy(3, 1, 5, e -> e instanceof TransientFetchException),
                new Metrics(registry));
    }

    @Test
    void okReturnsBodyWithRequestHeaders() throws Exception {
        RawPayload p = client(new MetricRegistry(), Duration.ofSeconds(5)).fetch(sub("ok"));
        assertEquals("ms_of_day\n1\n", new String(p.body(), StandardCharsets.UTF_8));
        assertFalse(p.isNoData());
        assertEquals("market-lake-test", lastUserAgent);
    }

    @Test
    void noDataAnswerIsAnEmptyPayload() throws Exception {
        RawPayload p = client(new MetricRegistry(), Duration.ofSeconds(5)).fetch(sub("nodata"));
        assertTrue(p.isNoData());
        assertTrue(p.isEmpty());
    }

    @Test
    void payloadCarriesTheLegOfItsSubRequest() throws Exception {
        HttpUpstreamClient client = client(new MetricRegistry(), Duration.ofSeconds(5));
        assertEquals(Leg.SINGLE, client.fetch(sub("ok")).leg());
        assertEquals(Leg.UNDERLYING, client.fetch(sub("ok", Leg.UNDERLYING)).leg());
        assertEquals(Leg.CONTRACTS, client.fetch(sub("nodata", Leg.CONTRACTS)).leg());
    }

    @Test
    void transientErrorsAreRetried() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        RawPayload p = client(registry, Duration.ofSeconds(5)).fetch(sub("flaky"));
        assertEquals("ok", new String(p.body(), StandardCharsets.UTF_8));
        assertEquals(3, flakyHits.get());
        assertEquals(2, registry.counter("upstream.retries").getCount());
    }

    @Test
    void exhaustedRetriesBecomePermanent() {
        PermanentFetchException e = assertThrows(PermanentFetchException.class,
                () -> client(new MetricRegistry(), Duration.ofSeconds(5)).fetch(sub("down")));
        assertEquals(500, e.statusCode());
        assertEquals(3, downHits.get());
        assertTrue(e.getCause() instanceof TransientFetchException);
    }

    @Test
    void clientErrorsAreNotRetried() {
        PermanentFetchException e = assertThrows(PermanentFetchException.class,
                () -> client(new MetricRegistry(), Duration.ofSeconds(5)).fetch(sub("missing")));
        assertEquals(404, e.statusCode());
        assertEquals(1, missingHits.get());
    }

    @Test
    void timeoutIsPermanent() {
        PermanentFetchException e = assertThrows(PermanentFetchException.class,
                () -> client(new MetricRegistry(), Duration.ofMillis(200)).fetch(sub("slow")));
        assertEquals(-1, e.statusCode());
    }
}
