package io.marketlake.budget;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket for external calls: refills {@code externalQps} tokens per second with a burst of one second.
 * A non-positive QPS means no limit.
 */
public class SimpleBudgetManager implements Budget {
    private final long externalQps;
    private final LongSupplier nanoClock;

    private long qpsTokens;
    private long lastQpsRefillNanos;

    public SimpleBudgetManager(long externalQps) {
        this(externalQps, System::nanoTime);
    }

    public SimpleBudgetManager(long externalQps, LongSupplier nanoClock) {
        this.externalQps = Math.max(0, externalQps);
        this.nanoClock = nanoClock == null ? System::nanoTime : nanoClock;
        this.lastQpsRefillNanos = this.nanoClock.getAsLong();
        this.qpsTokens = this.externalQps; // initial burst of 1s
    }

    @Override
    public void acquireExternalOp() throws InterruptedException {
        if (externalQps <= 0) return;
        while (!tryAcquireExternalOp()) {
            Thread.sleep(1);
        }
    }

    @Override
    public synchronized boolean tryAcquireExternalOp() {
        if (externalQps <= 0) return true;
        refillQps();
        if (qpsTokens > 0) {
            qpsTokens--;
            return true;
        }
        return false;
    }

    private void refillQps() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastQpsRefillNanos;
        if (elapsed <= 0) return;
        long add = (externalQps * elapsed) / TimeUnit.SECONDS.toNanos(1);
        if (add > 0) {
            qpsTokens = Math.min(externalQps, qpsTokens + add);
            lastQpsRefillNanos = now;
        }
    }
}
