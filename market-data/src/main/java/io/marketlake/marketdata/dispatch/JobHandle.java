package io.marketlake.marketdata.dispatch;

import io.marketlake.job.Job;
import io.marketlake.job.JobSnapshot;
import io.marketlake.marketdata.schema.CanonicalTable;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a submitted ingest. The result future completes with the {@link IngestResult}, exceptionally
 * with a {@link io.marketlake.marketdata.CommitException}, or with a cancellation.
 */
public final class JobHandle {
    private final Job<CanonicalTable> job;
    private final CompletableFuture<IngestResult> result;
    private final FanOutDispatcher dispatcher;

    JobHandle(Job<CanonicalTable> job, CompletableFuture<IngestResult> result, FanOutDispatcher dispatcher) {
        this.job = job;
        this.result = result;
        this.dispatcher = dispatcher;
    }

    public UUID jobId() { return job.id(); }

    Job<CanonicalTable> job() { return job; }

    public CompletableFuture<IngestResult> result() { return result; }

    public JobSnapshot snapshot() { return job.snapshot(); }

    public boolean isDone() { return result.isDone(); }

    /** Blocks for the result. */
    public IngestResult join() { return result.join(); }

    /**
     * Aborts the job. In-flight fetches drain and their completions are dropped. Returns false when the job had
     * already finalized or been cancelled.
     */
    public boolean cancel() { return dispatcher.cancel(this); }

    @Override
    public String toString() { return "JobHandle{" + job + '}'; }
}
