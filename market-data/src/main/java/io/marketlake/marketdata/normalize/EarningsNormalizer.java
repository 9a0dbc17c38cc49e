package io.marketlake.marketdata.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.schema.CanonicalTable;
import io.marketlake.marketdata.schema.SchemaMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Earnings calendar JSON: {@code {"data": {"asOf": "Mon, Sep 29, 2025", "rows": [...]}}}. Every row is stamped
 * with the ISO form of {@code asOf}. Display strings are turned into numbers; {@code N/A}, empty strings and
 * values that do not parse become null.
 */
public class EarningsNormalizer implements Normalizer {
    private static final Logger log = LoggerFactory.getLogger(EarningsNormalizer.class);
    private static final DateTimeFormatter AS_OF = DateTimeFormatter.ofPattern("EEE, MMM d, yyyy", Locale.US);

    private final ObjectMapper mapper;

    public EarningsNormalizer() { this(new ObjectMapper()); }

    public EarningsNormalizer(ObjectMapper mapper) { this.mapper = mapper; }

    @Override
    public CanonicalTable normalize(RawPayload payload, DatasetKind kind) {
        if (kind != DatasetKind.EARNINGS) throw new IllegalArgumentException("Not earnings: " + kind);
        if (payload.isEmpty()) return CanonicalTable.empty(kind);

        JsonNode root;
        try {
            root = mapper.readTree(payload.body());
        } catch (IOException e) {
            throw new SchemaMismatchException("Earnings payload from " + payload.source() + " is not JSON", e);
        }
        JsonNode data = root.path("data");
        JsonNode rows = data.path("rows");
        if (data.isMissingNode() || data.isNull() || !rows.isArray() || rows.isEmpty()) {
            return CanonicalTable.empty(kind);
        }

        String date = asOfToIso(data.path("asOf").asText(null));
        CanonicalTable.Builder out = CanonicalTable.builder(kind);
        for (JsonNode row : rows) {
            out.addRow(
                    date,
                    text(row, "symbol", ""),
                    text(row, "name", ""),
                    time(text(row, "time", null)),
                    currency(text(row, "eps", null)),
                    currency(text(row, "epsForecast", null)),
                    percentage(text(row, "surprise", null)),
                    marketCap(text(row, "marketCap", null)),
                    blankToNull(text(row, "fiscalQuarterEnding", null)),
                    integer(text(row, "noOfEsts", null)));
        }
        CanonicalTable table = out.build();
        log.debug("Normalized {} earnings rows for {}", table.rowCount(), date);
        return table;
    }

    static String asOfToIso(String asOf) {
        if (asOf == null || asOf.isBlank()) throw new SchemaMismatchException("Earnings payload has no asOf date");
        try {
            return LocalDate.parse(asOf.trim(), AS_OF).toString();
        } catch (DateTimeParseException e) {
            throw new SchemaMismatchException("Could not parse asOf date '" + asOf + "'", e);
        }
    }

    /** {@code $1.02}, {@code ($2.55)} for negatives, {@code 1,234.5}. */
    static Double currency(String value) {
        if (isNa(value)) return null;
        String cleaned = value.trim().replace("$", "").replace(",", "");
        if (cleaned.startsWith("(") && cleaned.endsWith(")")) {
            cleaned = "-" + cleaned.substring(1, cleaned.length() - 1);
        }
        return parseDouble(cleaned);
    }

    static Double percentage(String value) {
        if (isNa(value)) return null;
        return parseDouble(value.trim().replace("%", ""));
    }

    /** {@code $899,395,987}. */
    static Long marketCap(String value) {
        if (isNa(value)) return null;
        Double d = parseDouble(value.trim().replace("$", "").replace(",", ""));
        return d == null ? null : d.longValue();
    }

    static Long integer(String value) {
        if (isNa(value)) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String time(String value) {
        if (isNa(value) || "time-not-supplied".equals(value.trim())) return null;
        return value.trim();
    }

    private static Double parseDouble(String s) {
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isNa(String value) {
        return value == null || value.isBlank() || "N/A".equals(value.trim());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String text(JsonNode row, String field, String fallback) {
        JsonNode n = row.get(field);
        if (n == null || n.isNull()) return fallback;
        return n.asText().trim();
    }
}
