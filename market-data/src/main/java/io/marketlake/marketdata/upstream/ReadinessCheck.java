package io.marketlake.marketdata.upstream;

/** Whether the data provider can take requests right now. */
@FunctionalInterface
public interface ReadinessCheck {
    boolean isReady();

    static ReadinessCheck always() { return () -> true; }
}
