package io.marketlake.marketdata.normalize;

import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.schema.CanonicalTable;

import java.util.EnumMap;
import java.util.Map;

/**
 * Sends each payload to the normalizer registered for its kind. Construction fails unless every kind is covered,
 * so routing never falls through at runtime.
 */
public class NormalizerRouter {
    private final Map<DatasetKind, Normalizer> routes;

    public NormalizerRouter(Map<DatasetKind, Normalizer> routes) {
        EnumMap<DatasetKind, Normalizer> copy = new EnumMap<>(DatasetKind.class);
        copy.putAll(routes);
        for (DatasetKind kind : DatasetKind.values()) {
            if (copy.get(kind) == null) {
                throw new IllegalArgumentException("No normalizer registered for " + kind);
            }
        }
        this.routes = copy;
    }

    /** Options, stocks and earnings each to their own normalizer. */
    public static NormalizerRouter standard() {
        Map<DatasetKind, Normalizer> m = new EnumMap<>(DatasetKind.class);
        Normalizer option = new OptionNormalizer();
        Normalizer stock = new StockNormalizer();
        m.put(DatasetKind.OPTION_QUOTE, option);
        m.put(DatasetKind.OPTION_EOD, option);
        m.put(DatasetKind.STOCK_QUOTE, stock);
        m.put(DatasetKind.STOCK_EOD, stock);
        m.put(DatasetKind.EARNINGS, new EarningsNormalizer());
        return new NormalizerRouter(m);
    }

    public CanonicalTable normalize(RawPayload payload, DatasetKind kind) {
        if (kind == null) throw new IllegalArgumentException("Payload from " + payload.source() + " has no dataset kind");
        return routes.get(kind).normalize(payload, kind);
    }
}
