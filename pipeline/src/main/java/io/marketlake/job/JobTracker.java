package io.marketlake.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of jobs keyed by id, so status pollers can find them. Live jobs are held until their result has
 * been committed and {@link #retire(Job)} is called; after that only their final snapshot is kept, bounded to
 * the most recent {@code retainedSnapshots}.
 */
public class JobTracker<T> {
    private static final Logger log = LoggerFactory.getLogger(JobTracker.class);

    private final ConcurrentMap<UUID, Job<T>> live = new ConcurrentHashMap<>();
    private final Map<UUID, JobSnapshot> retired;

    public JobTracker() { this(1024); }

    public JobTracker(int retainedSnapshots) {
        int cap = Math.max(1, retainedSnapshots);
        this.retired = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, JobSnapshot> eldest) {
                return size() > cap;
            }
        });
    }

    public Job<T> create(int totalParts) {
        return create(UUID.randomUUID(), totalParts);
    }

    public Job<T> create(UUID id, int totalParts) {
        if (totalParts < 1) {
            throw new InvalidJobException(id, "totalParts must be >= 1 but was " + totalParts);
        }
        Job<T> job = new Job<>(id, totalParts);
        if (live.putIfAbsent(id, job) != null) {
            throw new InvalidJobException(id, "job " + id + " is already registered");
        }
        log.debug("Created job {} with {} parts", id, totalParts);
        return job;
    }

    public Completion recordCompletion(Job<T> job, int slot, T value) {
        return job.recordCompletion(slot, value);
    }

    public Completion recordFailure(Job<T> job, int slot, T sentinel, String reason) {
        return job.recordFailure(slot, sentinel, reason);
    }

    public JobSnapshot snapshot(Job<T> job) {
        return job.snapshot();
    }

    public Optional<JobSnapshot> snapshot(UUID id) {
        Job<T> job = live.get(id);
        if (job != null) return Optional.of(job.snapshot());
        return Optional.ofNullable(retired.get(id));
    }

    public boolean abort(Job<T> job) {
        boolean aborted = job.abort();
        if (aborted) log.info("Aborted job {}", job.id());
        return aborted;
    }

    /**
     * Drops the live reference to a terminal job, keeping only its final snapshot.
     */
    public void retire(Job<T> job) {
        JobSnapshot last = job.snapshot();
        if (!last.state().isTerminal()) {
            throw new InvalidJobException(job.id(), "cannot retire job " + job.id() + " while " + last.state());
        }
        retired.put(job.id(), last);
        live.remove(job.id(), job);
    }

    public int liveCount() { return live.size(); }
}
