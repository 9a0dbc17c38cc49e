package io.marketlake.marketdata.schema;

import io.marketlake.marketdata.DatasetKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static io.marketlake.marketdata.schema.ColumnType.*;

/**
 * The canonical schema of every dataset kind. Normalizers, the partition codec and retrieval all take their
 * column layout from here.
 */
public final class SchemaRegistry {
    private SchemaRegistry() {}

    public static final ColumnSpec QUOTE = ColumnSpec.of(
            new Column("ms_of_day", INT64),
            new Column("bid_size", INT32),
            new Column("bid_exchange", INT16),
            new Column("bid", FLOAT64),
            new Column("bid_condition", INT16),
            new Column("ask_size", INT32),
            new Column("ask_exchange", INT16),
            new Column("ask", FLOAT64),
            new Column("ask_condition", INT16),
            new Column("date", INT32));

    public static final ColumnSpec EOD = ColumnSpec.of(
            new Column("ms_of_day", INT64),
            new Column("ms_of_day_2", INT64),
            new Column("open", FLOAT64),
            new Column("high", FLOAT64),
            new Column("low", FLOAT64),
            new Column("close", FLOAT64),
            new Column("volume", INT64),
            new Column("count", INT64),
            new Column("bid_size", INT32),
            new Column("bid_exchange", INT16),
            new Column("bid", FLOAT64),
            new Column("bid_condition", INT16),
            new Column("ask_size", INT32),
            new Column("ask_exchange", INT16),
            new Column("ask", FLOAT64),
            new Column("ask_condition", INT16),
            new Column("date", INT32));

    public static final ColumnSpec CONTRACT = ColumnSpec.of(
            new Column("root", STRING),
            new Column("expiration", INT32),
            new Column("strike", INT64),
            new Column("right", STRING));

    public static final ColumnSpec EARNINGS = ColumnSpec.of(
            new Column("date", STRING),
            new Column("symbol", STRING),
            new Column("name", STRING),
            new Column("time", STRING),
            new Column("eps", FLOAT64),
            new Column("eps_forecast", FLOAT64),
            new Column("surprise_pct", FLOAT64),
            new Column("market_cap", INT64),
            new Column("fiscal_quarter_ending", STRING),
            new Column("num_estimates", INT64));

    private static final Map<DatasetKind, ColumnSpec> SPECS;

    static {
        Map<DatasetKind, ColumnSpec> m = new EnumMap<>(DatasetKind.class);
        m.put(DatasetKind.STOCK_QUOTE, QUOTE);
        m.put(DatasetKind.STOCK_EOD, EOD);
        m.put(DatasetKind.OPTION_QUOTE, CONTRACT.concat(QUOTE));
        m.put(DatasetKind.OPTION_EOD, CONTRACT.concat(EOD));
        m.put(DatasetKind.EARNINGS, EARNINGS);
        for (DatasetKind k : DatasetKind.values()) {
            if (!m.containsKey(k)) throw new ExceptionInInitializerError("no schema for " + k);
        }
        SPECS = Collections.unmodifiableMap(m);
    }

    public static ColumnSpec specFor(DatasetKind kind) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        return SPECS.get(kind);
    }

    /** Throws unless {@code header} lists exactly the kind's column names in order. */
    public static void validateHeader(DatasetKind kind, List<String> header, String source) {
        List<String> expected = specFor(kind).names();
        if (!expected.equals(header)) {
            throw new SchemaMismatchException("Header of " + source + " does not match " + kind
                    + " schema: expected " + expected + " but was " + header);
        }
    }
}
