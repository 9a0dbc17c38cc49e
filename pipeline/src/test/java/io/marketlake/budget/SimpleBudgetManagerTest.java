package io.marketlake.budget;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class SimpleBudgetManagerTest {
    @Test
    void bucket_holds_one_second_of_burst_then_refills() {
        AtomicLong now = new AtomicLong(0);
        SimpleBudgetManager b = new SimpleBudgetManager(3, now::get);
        assertTrue(b.tryAcquireExternalOp());
        assertTrue(b.tryAcquireExternalOp());
        assertTrue(b.tryAcquireExternalOp());
        assertFalse(b.tryAcquireExternalOp());

        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(400)); // 1.2 tokens
        assertTrue(b.tryAcquireExternalOp());
        assertFalse(b.tryAcquireExternalOp());
    }

    @Test
    void zero_qps_is_unlimited() throws Exception {
        SimpleBudgetManager b = new SimpleBudgetManager(0);
        for (int i = 0; i < 1000; i++) b.acquireExternalOp();
        assertTrue(Budget.unlimited().tryAcquireExternalOp());
    }

    @Test
    void blocking_acquire_spaces_calls() throws Exception {
        SimpleBudgetManager b = new SimpleBudgetManager(10); // 10 qps ~ 100ms spacing
        for (int i = 0; i < 10; i++) b.acquireExternalOp();
        long t0 = System.nanoTime();
        b.acquireExternalOp();
        long dt = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        assertTrue(dt >= 60, "expected spacing >= 60ms but was " + dt + "ms");
    }
}
