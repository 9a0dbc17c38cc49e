package io.marketlake.config;

import java.nio.file.Path;

public record IngestConfig(
        Path storageRoot,
        String bucket,
        String upstreamUrl,
        String earningsUrl,
        int workers,
        int httpTimeoutSeconds,
        long externalQps,
        int retryAttempts,
        long retryBaseMillis,
        long retryMaxMillis,
        int statusPort,
        Path deadLetterFile
) {
    public static final String DEFAULT_UPSTREAM_URL = "http://127.0.0.1:25510/v2";
    public static final String DEFAULT_EARNINGS_URL = "https://api.nasdaq.com/api/calendar/earnings";

    public IngestConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1 but was " + workers);
        if (httpTimeoutSeconds < 1) throw new IllegalArgumentException("httpTimeoutSeconds must be >= 1");
        if (bucket == null || bucket.isBlank()) throw new IllegalArgumentException("bucket must not be blank");
        if (deadLetterFile == null) deadLetterFile = storageRoot.resolve("dead-letter.jsonl");
    }

    public static IngestConfig fromEnv() {
        Path root = Path.of(setting("marketlake.storage.root", "MARKETLAKE_STORAGE_ROOT", "./lake"));
        String bucket = setting("marketlake.bucket", "MARKETLAKE_BUCKET", "betedge-data");
        String upstream = setting("marketlake.upstream.url", "MARKETLAKE_UPSTREAM_URL", DEFAULT_UPSTREAM_URL);
        String earnings = setting("marketlake.earnings.url", "MARKETLAKE_EARNINGS_URL", DEFAULT_EARNINGS_URL);
        int workers = Integer.parseInt(setting("marketlake.workers", "MARKETLAKE_WORKERS", "2"));
        int timeout = Integer.parseInt(setting("marketlake.http.timeout.seconds", "MARKETLAKE_HTTP_TIMEOUT_SECONDS", "60"));
        long qps = Long.parseLong(setting("marketlake.qps", "MARKETLAKE_QPS", "0"));
        int attempts = Integer.parseInt(setting("marketlake.retry.attempts", "MARKETLAKE_RETRY_ATTEMPTS", "3"));
        long base = Long.parseLong(setting("marketlake.retry.base.ms", "MARKETLAKE_RETRY_BASE_MS", "250"));
        long max = Long.parseLong(setting("marketlake.retry.max.ms", "MARKETLAKE_RETRY_MAX_MS", "5000"));
        int port = Integer.parseInt(setting("marketlake.status.port", "MARKETLAKE_STATUS_PORT", "0"));
        String dlq = setting("marketlake.dlq", "MARKETLAKE_DLQ", null);
        return new IngestConfig(root, bucket, upstream, earnings, workers, timeout, qps, attempts, base, max, port,
                dlq == null ? null : Path.of(dlq));
    }

    public static IngestConfig defaults(Path storageRoot) {
        return new IngestConfig(storageRoot, "betedge-data", DEFAULT_UPSTREAM_URL, DEFAULT_EARNINGS_URL,
                2, 60, 0, 3, 250, 5000, 0, null);
    }

    public IngestConfig withWorkers(int n) {
        return new IngestConfig(storageRoot, bucket, upstreamUrl, earningsUrl, n, httpTimeoutSeconds, externalQps,
                retryAttempts, retryBaseMillis, retryMaxMillis, statusPort, deadLetterFile);
    }

    public IngestConfig withUpstreamUrl(String url) {
        return new IngestConfig(storageRoot, bucket, url, earningsUrl, workers, httpTimeoutSeconds, externalQps,
                retryAttempts, retryBaseMillis, retryMaxMillis, statusPort, deadLetterFile);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
