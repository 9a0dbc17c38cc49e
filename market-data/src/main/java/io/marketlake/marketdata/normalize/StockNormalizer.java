package io.marketlake.marketdata.normalize;

import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.schema.CanonicalTable;
import io.marketlake.marketdata.schema.CsvTableCodec;

public class StockNormalizer implements Normalizer {
    @Override
    public CanonicalTable normalize(RawPayload payload, DatasetKind kind) {
        if (!kind.isStock()) throw new IllegalArgumentException("Not a stock kind: " + kind);
        if (payload.isEmpty()) return CanonicalTable.empty(kind);
        return CsvTableCodec.decode(payload.body(), kind, String.valueOf(payload.source()));
    }
}
