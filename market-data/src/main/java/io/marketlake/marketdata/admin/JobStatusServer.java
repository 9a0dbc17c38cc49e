package io.marketlake.marketdata.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.marketlake.job.JobSnapshot;
import io.marketlake.job.JobTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Minimal status server: {@code GET /jobs/{id}} returns a job snapshot, {@code GET /metrics} the registry's
 * counters, meters and timers, both as JSON.
 */
public class JobStatusServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobStatusServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpServer server;
    private final ExecutorService executor;
    private final JobTracker<?> tracker;
    private final MetricRegistry registry;

    public JobStatusServer(int port, JobTracker<?> tracker, MetricRegistry registry) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
        this.tracker = tracker;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool();
        server.createContext("/jobs/", new JobsHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("Job status server listening on port {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private class JobsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                exchange.close();
                return;
            }
            String id = exchange.getRequestURI().getPath().substring("/jobs/".length());
            UUID jobId;
            try {
                jobId = UUID.fromString(id);
            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, Map.of("error", "not a job id: " + id));
                return;
            }
            Optional<JobSnapshot> snapshot = tracker.snapshot(jobId);
            if (snapshot.isEmpty()) {
                sendJson(exchange, 404, Map.of("error", "unknown job " + jobId));
                return;
            }
            sendJson(exchange, 200, describe(snapshot.get()));
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Map<String, Object> counters = new LinkedHashMap<>();
            for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
                counters.put(e.getKey(), e.getValue().getCount());
            }
            Map<String, Object> meters = new LinkedHashMap<>();
            for (Map.Entry<String, Meter> e : registry.getMeters().entrySet()) {
                meters.put(e.getKey(), Map.of("count", e.getValue().getCount(),
                        "m1_rate", e.getValue().getOneMinuteRate()));
            }
            Map<String, Object> timers = new LinkedHashMap<>();
            for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
                var s = e.getValue().getSnapshot();
                timers.put(e.getKey(), Map.of("count", e.getValue().getCount(),
                        "p50_ms", s.getMedian() / 1_000_000.0,
                        "p99_ms", s.get99thPercentile() / 1_000_000.0));
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("counters", counters);
            body.put("meters", meters);
            body.put("timers", timers);
            body.put("liveJobs", tracker.liveCount());
            sendJson(exchange, 200, body);
        }
    }

    static Map<String, Object> describe(JobSnapshot s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("jobId", s.jobId().toString());
        m.put("state", s.state().name());
        m.put("completedParts", s.completedParts());
        m.put("totalParts", s.totalParts());
        m.put("failedParts", s.failedParts());
        m.put("progressPercentage", s.progressPercentage());
        m.put("createdAt", s.createdAt().toString());
        m.put("updatedAt", s.updatedAt().toString());
        return m;
    }

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
