package io.marketlake.marketdata.dispatch;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.marketlake.error.DeadLetterSink;
import io.marketlake.job.Completion;
import io.marketlake.job.Job;
import io.marketlake.job.JobSnapshot;
import io.marketlake.job.JobState;
import io.marketlake.job.JobTracker;
import io.marketlake.marketdata.CommitException;
import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.EmptyExpansionException;
import io.marketlake.marketdata.LogicalRequest;
import io.marketlake.marketdata.PartitionAddressing;
import io.marketlake.marketdata.PartitionKey;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.SubRequest;
import io.marketlake.marketdata.SubRequestPlanner;
import io.marketlake.marketdata.UpstreamNotReadyException;
import io.marketlake.marketdata.normalize.NormalizerRouter;
import io.marketlake.marketdata.schema.CanonicalTable;
import io.marketlake.marketdata.schema.CsvTableCodec;
import io.marketlake.marketdata.schema.SchemaMismatchException;
import io.marketlake.marketdata.store.ObjectStore;
import io.marketlake.marketdata.upstream.FetchException;
import io.marketlake.marketdata.upstream.ReadinessCheck;
import io.marketlake.marketdata.upstream.UpstreamClient;
import io.marketlake.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns one logical request into many fetches on a fixed worker pool and commits the result once.
 * <p>
 * Each worker fetches and normalizes its sub-request and records the table in the job's slot. Failed fetches and
 * payloads that do not fit the schema record an empty table in their slot instead, so the job always completes.
 * The worker whose record completes the job is the only one that writes partitions.
 */
public class FanOutDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FanOutDispatcher.class);

    private final SubRequestPlanner planner;
    private final UpstreamClient upstream;
    private final NormalizerRouter router;
    private final ObjectStore store;
    private final ReadinessCheck readiness;
    private final JobTracker<CanonicalTable> tracker;
    private final DeadLetterSink<SubRequest> deadLetters;
    private final ExecutorService workerPool;

    private final Timer fetchTimer;
    private final Timer normalizeTimer;
    private final Timer commitTimer;
    private final Meter completedMeter;
    private final Meter failedMeter;
    private final Counter rowsCommitted;
    private final Counter partitionsCommitted;
    private final Counter jobsFinalized;
    private final Counter jobsAborted;

    public FanOutDispatcher(SubRequestPlanner planner,
                            UpstreamClient upstream,
                            NormalizerRouter router,
                            ObjectStore store,
                            ReadinessCheck readiness,
                            JobTracker<CanonicalTable> tracker,
                            DeadLetterSink<SubRequest> deadLetters,
                            Metrics metrics,
                            int workers) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1 but was " + workers);
        this.planner = planner;
        this.upstream = upstream;
        this.router = router;
        this.store = store;
        this.readiness = readiness == null ? ReadinessCheck.always() : readiness;
        this.tracker = tracker;
        this.deadLetters = deadLetters == null ? DeadLetterSink.discarding() : deadLetters;
        this.workerPool = Executors.newFixedThreadPool(workers, namedThreads("fanout-worker"));

        Metrics m = metrics == null ? new Metrics(null) : metrics;
        this.fetchTimer = m.timer("dispatch.fetch.time");
        this.normalizeTimer = m.timer("dispatch.normalize.time");
        this.commitTimer = m.timer("dispatch.commit.time");
        this.completedMeter = m.meter("dispatch.subrequests.completed");
        this.failedMeter = m.meter("dispatch.subrequests.failed");
        this.rowsCommitted = m.counter("dispatch.rows.committed");
        this.partitionsCommitted = m.counter("dispatch.partitions.committed");
        this.jobsFinalized = m.counter("dispatch.jobs.finalized");
        this.jobsAborted = m.counter("dispatch.jobs.aborted");
    }

    /**
     * Expands, registers and schedules {@code request}.
     *
     * @throws io.marketlake.marketdata.InvalidRangeException when the range cannot be expanded
     * @throws EmptyExpansionException when there is nothing to fetch
     * @throws UpstreamNotReadyException when the provider terminal is not ready
     * @throws IllegalStateException when the dispatcher has been closed
     */
    public JobHandle submit(LogicalRequest request, SubmitMode mode) {
        if (workerPool.isShutdown()) {
            throw new IllegalStateException("Dispatcher is closed; cannot submit " + request);
        }
        List<PartitionKey> keys = PartitionAddressing.keysFor(request);
        Set<PartitionKey> stored = request.forceRefresh() ? Set.of() : storedAmong(keys);
        SubRequestPlanner.Expansion expansion = planner.plan(request, stored);
        if (expansion.isEmpty()) {
            if (!expansion.skipped().isEmpty()) {
                throw new EmptyExpansionException("All " + expansion.skipped().size() + " partition(s) of " + request
                        + " are already stored; use forceRefresh to fetch them again");
            }
            throw new EmptyExpansionException(request + " covers no trading days");
        }
        if (request.kind() != DatasetKind.EARNINGS && !readiness.isReady()) {
            throw new UpstreamNotReadyException("Data provider is not ready; is the terminal running?");
        }

        List<SubRequest> subs = expansion.subRequests();
        Job<CanonicalTable> job = tracker.create(request.id(), subs.size());
        CompletableFuture<IngestResult> result = new CompletableFuture<>();
        JobHandle handle = new JobHandle(job, result, this);
        List<String> skipped = new ArrayList<>();
        for (PartitionKey k : expansion.skipped()) skipped.add(k.path());

        log.info("Job {} started: {} sub-requests over {} partition(s) for {}",
                job.id(), subs.size(), expansion.keys().size(), request);
        try {
            for (SubRequest sub : subs) {
                workerPool.execute(() -> runSlot(handle, request.kind(), sub, subs, skipped));
            }
        } catch (RejectedExecutionException e) {
            // Slots already queued see the abort and skip.
            tracker.abort(job);
            jobsAborted.inc();
            tracker.retire(job);
            result.cancel(false);
            throw new IllegalStateException("Dispatcher closed while scheduling job " + job.id(), e);
        }

        if (mode == SubmitMode.SYNC) {
            result.handle((r, e) -> null).join();
        }
        return handle;
    }

    public Optional<JobSnapshot> poll(UUID jobId) {
        return tracker.snapshot(jobId);
    }

    public JobSnapshot poll(JobHandle handle) {
        return handle.snapshot();
    }

    boolean cancel(JobHandle handle) {
        Job<CanonicalTable> job = handle.job();
        if (!tracker.abort(job)) return false;
        jobsAborted.inc();
        tracker.retire(job);
        handle.result().cancel(false);
        return true;
    }

    private void runSlot(JobHandle handle, DatasetKind kind, SubRequest sub, List<SubRequest> subs, List<String> skipped) {
        Job<CanonicalTable> job = handle.job();
        if (job.state() == JobState.ABORTED) {
            log.debug("Job {} aborted, skipping slot {}", job.id(), sub.slot());
            return;
        }

        CanonicalTable table = null;
        String stage = "fetch";
        Exception failure = null;
        try {
            RawPayload payload;
            try (Timer.Context ignored = fetchTimer.time()) {
                payload = upstream.fetch(sub);
            }
            stage = "normalize";
            try (Timer.Context ignored = normalizeTimer.time()) {
                table = router.normalize(payload, kind);
            }
        } catch (FetchException | SchemaMismatchException e) {
            failure = e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure in slot {} of job {}", sub.slot(), job.id(), e);
            failure = e;
        }

        Completion completion;
        if (failure == null) {
            completedMeter.mark();
            log.debug("Slot {} of job {}: {} rows from {}", sub.slot(), job.id(), table.rowCount(), sub.uri());
            completion = tracker.recordCompletion(job, sub.slot(), table);
        } else {
            failedMeter.mark();
            String reason = stage + ": " + failure.getMessage();
            log.warn("Slot {} of job {} failed at {}: {}", sub.slot(), job.id(), sub.uri(), reason);
            deadLetters.acceptFailure(stage, sub, failure);
            completion = tracker.recordFailure(job, sub.slot(), CanonicalTable.empty(kind), reason);
        }

        if (completion == Completion.DROPPED) {
            log.debug("Dropped late completion of slot {} for aborted job {}", sub.slot(), job.id());
        } else if (completion.isFinalizer()) {
            commit(handle, kind, subs, skipped);
        }
    }

    // Runs on exactly one worker per job.
    private void commit(JobHandle handle, DatasetKind kind, List<SubRequest> subs, List<String> skipped) {
        Job<CanonicalTable> job = handle.job();
        try (Timer.Context ignored = commitTimer.time()) {
            List<CanonicalTable> tables = job.values();
            Map<Integer, String> failures = job.failures();

            Map<PartitionKey, List<Integer>> slotsByKey = new LinkedHashMap<>();
            for (SubRequest sub : subs) {
                slotsByKey.computeIfAbsent(sub.partitionKey(), k -> new ArrayList<>()).add(sub.slot());
            }

            long rows = 0;
            List<String> committed = new ArrayList<>();
            List<String> empty = new ArrayList<>();
            for (Map.Entry<PartitionKey, List<Integer>> e : slotsByKey.entrySet()) {
                String key = e.getKey().path();
                List<CanonicalTable> parts = new ArrayList<>();
                for (int slot : e.getValue()) {
                    if (!failures.containsKey(slot)) parts.add(tables.get(slot));
                }
                if (parts.isEmpty()) {
                    log.warn("Job {}: every slot of {} failed, not writing it", job.id(), key);
                    empty.add(key);
                    continue;
                }
                CanonicalTable partition = CanonicalTable.concat(kind, parts);
                try {
                    store.put(key, CsvTableCodec.encode(partition));
                } catch (IOException ex) {
                    throw new CommitException(job.id(), key, ex);
                }
                rows += partition.rowCount();
                committed.add(key);
                partitionsCommitted.inc();
                rowsCommitted.inc(partition.rowCount());
            }

            List<FailedSlot> failed = new ArrayList<>();
            for (Map.Entry<Integer, String> f : failures.entrySet()) {
                failed.add(new FailedSlot(f.getKey(), subs.get(f.getKey()).uri(), f.getValue()));
            }
            IngestResult result = new IngestResult(job.id(), JobState.FINALIZED, job.totalParts(), rows,
                    failed, committed, skipped, empty);
            jobsFinalized.inc();
            log.info("Job {} committed: {}", job.id(), result.summary());
            handle.result().complete(result);
        } catch (RuntimeException e) {
            log.error("Job {} failed to commit", job.id(), e);
            handle.result().completeExceptionally(e);
        } finally {
            tracker.retire(job);
        }
    }

    private Set<PartitionKey> storedAmong(List<PartitionKey> keys) {
        Set<PartitionKey> stored = new HashSet<>();
        try {
            for (PartitionKey k : keys) {
                if (store.exists(k.path())) stored.add(k);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not check stored partitions", e);
        }
        return stored;
    }

    @Override
    public void close() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after 30s, interrupting");
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
