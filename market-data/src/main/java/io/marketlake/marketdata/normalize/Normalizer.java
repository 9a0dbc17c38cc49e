package io.marketlake.marketdata.normalize;

import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.schema.CanonicalTable;

/**
 * Parses one raw payload into a canonical table of {@code kind}. Implementations are pure: no network or storage.
 */
@FunctionalInterface
public interface Normalizer {
    /**
     * @throws io.marketlake.marketdata.schema.SchemaMismatchException when the payload does not fit the schema
     */
    CanonicalTable normalize(RawPayload payload, DatasetKind kind);
}
