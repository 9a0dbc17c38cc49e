package io.marketlake.marketdata.normalize;

import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.Leg;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.schema.CanonicalTable;
import io.marketlake.marketdata.schema.CsvTableCodec;
import io.marketlake.marketdata.schema.SchemaMismatchException;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Option contracts come straight from the bulk endpoint. The underlying stock leg of an option request is parsed
 * with the stock schema and padded into the option layout: {@code root} is the symbol, {@code expiration} is 0,
 * {@code strike} and {@code right} are null. The leg is read from the payload tag, never from the URL.
 */
public class OptionNormalizer implements Normalizer {
    @Override
    public CanonicalTable normalize(RawPayload payload, DatasetKind kind) {
        if (!kind.isOption()) throw new IllegalArgumentException("Not an option kind: " + kind);
        if (payload.isEmpty()) return CanonicalTable.empty(kind);
        String source = String.valueOf(payload.source());
        if (payload.leg() != Leg.UNDERLYING) {
            return CsvTableCodec.decode(payload.body(), kind, source);
        }

        CanonicalTable stock = CsvTableCodec.decode(payload.body(), kind.underlying(), source);
        String root = queryParam(payload.source(), "root");
        if (root == null) throw new SchemaMismatchException("Underlying leg " + source + " names no root");

        CanonicalTable.Builder out = CanonicalTable.builder(kind);
        int width = stock.columnCount();
        for (int r = 0; r < stock.rowCount(); r++) {
            Object[] row = new Object[4 + width];
            row[0] = root;
            row[1] = 0;
            row[2] = null;
            row[3] = null;
            for (int c = 0; c < width; c++) row[4 + c] = stock.get(r, c);
            out.addRow(row);
        }
        return out.build();
    }

    static String queryParam(URI uri, String name) {
        String q = uri == null ? null : uri.getRawQuery();
        if (q == null) return null;
        for (String pair : q.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
