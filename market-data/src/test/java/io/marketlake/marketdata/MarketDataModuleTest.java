package io.marketlake.marketdata;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.marketlake.config.IngestConfig;
import io.marketlake.job.JobTracker;
import io.marketlake.marketdata.dispatch.FanOutDispatcher;
import io.marketlake.marketdata.dispatch.IngestResult;
import io.marketlake.marketdata.dispatch.SubmitMode;
import io.marketlake.marketdata.retrieve.Dataset;
import io.marketlake.marketdata.retrieve.MissingPolicy;
import io.marketlake.marketdata.retrieve.RetrievalScanner;
import io.marketlake.marketdata.schema.CanonicalTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataModuleTest {
    @TempDir
    Path root;

    HttpServer provider;

    @BeforeEach
    void setUp() throws Exception {
        provider = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        provider.createContext("/v2/list/", ex -> respond(ex, 200, "20240102\n"));
        provider.createContext("/v2/hist/stock/eod", ex -> {
            String day = param(ex, "start_date");
            if ("20240104".equals(day)) {
                respond(ex, 472, ":No data for the specified timeframe & contract.");
                return;
            }
            respond(ex, 200, Fixtures.stockEodCsv(LocalDate.parse(day, DateTimeFormatter.BASIC_ISO_DATE), 2));
        });
        provider.start();
    }

    @AfterEach
    void tearDown() {
        provider.stop(0);
    }

    private static String param(HttpExchange ex, String name) {
        for (String pair : ex.getRequestURI().getRawQuery().split("&")) {
            if (pair.startsWith(name + "=")) return pair.substring(name.length() + 1);
        }
        return null;
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private Injector injector() {
        IngestConfig config = IngestConfig.defaults(root)
                .withUpstreamUrl("http://127.0.0.1:" + provider.getAddress().getPort() + "/v2")
                .withWorkers(3);
        return Guice.createInjector(new MarketDataModule(config));
    }

    @Test
    void sharesOneTrackerAndStoreAcrossTheGraph() {
        Injector injector = injector();
        assertSame(injector.getInstance(FanOutDispatcher.class), injector.getInstance(FanOutDispatcher.class));
        assertSame(injector.getInstance(Key.get(new TypeLiteral<JobTracker<CanonicalTable>>() {})),
                injector.getInstance(Key.get(new TypeLiteral<JobTracker<CanonicalTable>>() {})));
        assertNotNull(injector.getInstance(RetrievalScanner.class));
        assertTrue(Files.isDirectory(root.resolve("betedge-data")));
    }

    @Test
    void ingestsThenRetrievesThroughTheWiredGraph() throws Exception {
        Injector injector = injector();
        LogicalRequest request = LogicalRequest.builder(DatasetKind.STOCK_EOD).symbol("spy")
                .range(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 5)).build();

        IngestResult result;
        try (FanOutDispatcher dispatcher = injector.getInstance(FanOutDispatcher.class)) {
            result = dispatcher.submit(request, SubmitMode.SYNC).join();
        }
        assertFalse(result.hasFailures());
        assertEquals(6, result.rowsWritten());
        assertEquals(List.of("historical-stock/eod/monthly/1d/SPY/2024/01/data.csv"), result.committedKeys());
        assertTrue(Files.isRegularFile(root.resolve("betedge-data/historical-stock/eod/monthly/1d/SPY/2024/01/data.csv")));

        Dataset ds = injector.getInstance(RetrievalScanner.class).retrieve(request, MissingPolicy.FAIL);
        CanonicalTable table = ds.collect();
        assertEquals(6, table.rowCount());
        assertEquals(List.of(20240102, 20240102, 20240103, 20240103, 20240105, 20240105), table.column("date"));
    }

    @Test
    void failedSlotsLandInTheDeadLetterFile() throws Exception {
        provider.createContext("/v2/hist/stock/quote", ex -> respond(ex, 404, "unknown root"));
        Injector injector = injector();
        LogicalRequest request = LogicalRequest.builder(DatasetKind.STOCK_QUOTE).symbol("ZZZZ")
                .range(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 2)).build();

        IngestResult result;
        try (FanOutDispatcher dispatcher = injector.getInstance(FanOutDispatcher.class)) {
            result = dispatcher.submit(request, SubmitMode.SYNC).join();
        }
        assertEquals(1, result.failedSlots().size());
        assertEquals(List.of("historical-stock/quote/monthly/1h/ZZZZ/2024/01/data.csv"), result.emptyKeys());

        List<String> lines = Files.readAllLines(IngestConfig.defaults(root).deadLetterFile());
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"stage\":\"fetch\""));
        assertTrue(lines.get(0).contains("ZZZZ"));
    }
}
