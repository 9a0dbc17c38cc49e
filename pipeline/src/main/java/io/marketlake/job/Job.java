package io.marketlake.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Completion state for one fan-out: a fixed number of slots, each filled exactly once by whichever worker
 * produced it. Values are kept by slot index so the assembled output follows slot order, not arrival order.
 * <p>
 * The whole "store + count + compare to total" step runs under one lock, so exactly one caller ever
 * receives {@link Completion#FINALIZE}. The lock is never held by callers across I/O.
 */
public final class Job<T> {
    private final UUID id;
    private final int totalParts;
    private final Object[] slots;
    private final boolean[] filled;
    private final Map<Integer, String> failures = new TreeMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Instant createdAt;

    private int completedParts;
    private JobState state = JobState.OPEN;
    private Instant updatedAt;

    Job(UUID id, int totalParts) {
        if (totalParts < 1) {
            throw new InvalidJobException(id, "totalParts must be >= 1 but was " + totalParts);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.totalParts = totalParts;
        this.slots = new Object[totalParts];
        this.filled = new boolean[totalParts];
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public UUID id() { return id; }
    public int totalParts() { return totalParts; }

    public Completion recordCompletion(int slot, T value) {
        return record(slot, value, null);
    }

    /**
     * Fills {@code slot} with a placeholder value and remembers why the real value is missing. Counts toward
     * completion exactly like {@link #recordCompletion(int, Object)}.
     */
    public Completion recordFailure(int slot, T sentinel, String reason) {
        return record(slot, sentinel, reason == null ? "unknown failure" : reason);
    }

    private Completion record(int slot, T value, String failure) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (state == JobState.ABORTED) return Completion.DROPPED;
            if (state == JobState.FINALIZED) throw new JobAlreadyFinalizedException(id, slot);
            if (slot < 0 || slot >= totalParts) {
                throw new InvalidJobException(id, "slot " + slot + " outside [0," + totalParts + ")");
            }
            if (filled[slot]) throw new DuplicateSlotException(id, slot);

            slots[slot] = value;
            filled[slot] = true;
            if (failure != null) failures.put(slot, failure);
            completedParts++;
            updatedAt = Instant.now();

            if (completedParts == totalParts) {
                state = JobState.FINALIZED;
                return Completion.FINALIZE;
            }
            return Completion.RECORDED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an open job to ABORTED. Returns false when the job had already reached a terminal state.
     */
    public boolean abort() {
        lock.lock();
        try {
            if (state != JobState.OPEN) return false;
            state = JobState.ABORTED;
            updatedAt = Instant.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot snapshot() {
        lock.lock();
        try {
            return new JobSnapshot(id, completedParts, totalParts, failures.size(), state, createdAt, updatedAt);
        } finally {
            lock.unlock();
        }
    }

    public JobState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Slot-ordered values. Only available once the job is finalized.
     */
    @SuppressWarnings("unchecked")
    public List<T> values() {
        lock.lock();
        try {
            if (state != JobState.FINALIZED) {
                throw new IllegalStateException("job " + id + " is " + state + ", values are only readable once finalized");
            }
            List<T> out = new ArrayList<>(totalParts);
            for (Object o : slots) out.add((T) o);
            return Collections.unmodifiableList(out);
        } finally {
            lock.unlock();
        }
    }

    /** Failed slot index to failure reason, ascending by slot. */
    public Map<Integer, String> failures() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(failures));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        JobSnapshot s = snapshot();
        return "Job{" +
                "id=" + id +
                ", completed=" + s.completedParts() + "/" + totalParts +
                ", failed=" + s.failedParts() +
                ", state=" + s.state() +
                '}';
    }
}
