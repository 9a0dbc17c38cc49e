package io.marketlake.marketdata;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.marketlake.budget.Budget;
import io.marketlake.budget.SimpleBudgetManager;
import io.marketlake.config.IngestConfig;
import io.marketlake.error.DeadLetterSink;
import io.marketlake.error.FileDeadLetterSink;
import io.marketlake.job.JobTracker;
import io.marketlake.marketdata.dispatch.FanOutDispatcher;
import io.marketlake.marketdata.normalize.NormalizerRouter;
import io.marketlake.marketdata.retrieve.RetrievalScanner;
import io.marketlake.marketdata.schema.CanonicalTable;
import io.marketlake.marketdata.store.FileSystemObjectStore;
import io.marketlake.marketdata.store.ObjectStore;
import io.marketlake.marketdata.upstream.HttpReadinessCheck;
import io.marketlake.marketdata.upstream.HttpUpstreamClient;
import io.marketlake.marketdata.upstream.ReadinessCheck;
import io.marketlake.marketdata.upstream.TransientFetchException;
import io.marketlake.marketdata.upstream.UpstreamClient;
import io.marketlake.metrics.Metrics;
import io.marketlake.retry.ExponentialBackoffRetryPolicy;
import io.marketlake.retry.RetryPolicy;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class MarketDataModule extends AbstractModule {
    private final IngestConfig config;

    public MarketDataModule(IngestConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(IngestConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Budget budget() { return new SimpleBudgetManager(config.externalQps()); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.retryAttempts(), config.retryBaseMillis(), config.retryMaxMillis(),
                e -> e instanceof TransientFetchException);
    }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }

    @Provides @Singleton UpstreamClient upstreamClient(HttpClient http, Budget budget, RetryPolicy retry, Metrics metrics) {
        return new HttpUpstreamClient(http, Duration.ofSeconds(config.httpTimeoutSeconds()), budget, retry, metrics);
    }

    @Provides @Singleton ReadinessCheck readinessCheck(HttpClient http) {
        return new HttpReadinessCheck(http, config.upstreamUrl(), Duration.ofSeconds(5));
    }

    @Provides @Singleton ObjectStore objectStore() throws IOException {
        return new FileSystemObjectStore(config.storageRoot(), config.bucket());
    }

    @Provides @Singleton NormalizerRouter normalizerRouter() { return NormalizerRouter.standard(); }

    @Provides @Singleton JobTracker<CanonicalTable> jobTracker() { return new JobTracker<>(); }

    @Provides @Singleton DeadLetterSink<SubRequest> deadLetters() throws IOException {
        return new FileDeadLetterSink<>(config.deadLetterFile(), MarketDataModule::describe);
    }

    @Provides @Singleton SubRequestPlanner planner() {
        return new SubRequestPlanner(config.upstreamUrl(), config.earningsUrl());
    }

    @Provides @Singleton FanOutDispatcher dispatcher(SubRequestPlanner planner, UpstreamClient upstream, NormalizerRouter router,
                                                     ObjectStore store, ReadinessCheck readiness, JobTracker<CanonicalTable> tracker,
                                                     DeadLetterSink<SubRequest> deadLetters, Metrics metrics) {
        return new FanOutDispatcher(planner, upstream, router, store, readiness, tracker, deadLetters, metrics, config.workers());
    }

    @Provides @Singleton RetrievalScanner retrievalScanner(ObjectStore store, Metrics metrics) {
        return new RetrievalScanner(store, metrics);
    }

    static Map<String, Object> describe(SubRequest sub) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("slot", sub.slot());
        m.put("kind", sub.kind().name());
        m.put("leg", sub.leg().name());
        m.put("tradingDate", String.valueOf(sub.tradingDate()));
        m.put("partitionKey", sub.partitionKey().path());
        m.put("uri", sub.uri().toString());
        return m;
    }
}
