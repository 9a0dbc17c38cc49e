package io.marketlake.marketdata;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Objects;

/**
 * Deterministic object-store address of one stored partition. {@link #path()} and {@link #parse(String)} are
 * exact inverses; the ingest and retrieval paths both go through them.
 * <pre>
 * historical-options/{endpoint}/{granularity}/{interval}/{SYMBOL}/{YYYY}/{MM}[/{DD}]/data.csv
 * historical-stock/{endpoint}/{granularity}/{interval}/{SYMBOL}/{YYYY}/{MM}[/{DD}]/data.csv
 * earnings/{YYYY}/{MM}/data.csv
 * </pre>
 * {@code day} is 0 for monthly partitions.
 */
public record PartitionKey(DatasetKind kind,
                           String symbol,
                           FileGranularity granularity,
                           String interval,
                           int year,
                           int month,
                           int day) implements Comparable<PartitionKey> {

    public static final String FILE_NAME = "data.csv";

    public PartitionKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(granularity, "granularity");
        if (kind.hasSymbol()) {
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(interval, "interval");
        } else if (granularity != FileGranularity.MONTHLY) {
            throw new IllegalArgumentException("Earnings partitions are monthly");
        }
        if (month < 1 || month > 12) throw new IllegalArgumentException("month out of range: " + month);
        if (granularity == FileGranularity.DAILY && (day < 1 || day > 31)) {
            throw new IllegalArgumentException("daily partition needs a day, got " + day);
        }
        if (granularity == FileGranularity.MONTHLY && day != 0) {
            throw new IllegalArgumentException("monthly partition cannot carry a day");
        }
    }

    public static PartitionKey monthly(DatasetKind kind, String symbol, String interval, YearMonth ym) {
        return new PartitionKey(kind, symbol, FileGranularity.MONTHLY, interval, ym.getYear(), ym.getMonthValue(), 0);
    }

    public static PartitionKey daily(DatasetKind kind, String symbol, String interval, LocalDate d) {
        return new PartitionKey(kind, symbol, FileGranularity.DAILY, interval, d.getYear(), d.getMonthValue(), d.getDayOfMonth());
    }

    public static PartitionKey earnings(YearMonth ym) {
        return new PartitionKey(DatasetKind.EARNINGS, null, FileGranularity.MONTHLY, null, ym.getYear(), ym.getMonthValue(), 0);
    }

    public YearMonth yearMonth() { return YearMonth.of(year, month); }

    public String path() {
        StringBuilder sb = new StringBuilder(96);
        sb.append(prefix());
        sb.append('/').append(String.format(Locale.ROOT, "%04d", year));
        sb.append('/').append(String.format(Locale.ROOT, "%02d", month));
        if (granularity == FileGranularity.DAILY) sb.append('/').append(String.format(Locale.ROOT, "%02d", day));
        return sb.append('/').append(FILE_NAME).toString();
    }

    /** Everything before the year segment. */
    String prefix() {
        if (!kind.hasSymbol()) return kind.prefix();
        return kind.prefix() + '/' + kind.endpoint() + '/' + granularity.segment() + '/' + interval + '/' + symbol;
    }

    public static PartitionKey parse(String path) {
        String[] p = path.split("/");
        PartitionKey key = null;
        try {
            if (p.length == 4 && DatasetKind.EARNINGS.prefix().equals(p[0]) && FILE_NAME.equals(p[3])) {
                key = earnings(YearMonth.of(Integer.parseInt(p[1]), Integer.parseInt(p[2])));
            } else if ((p.length == 8 || p.length == 9) && FILE_NAME.equals(p[p.length - 1])) {
                DatasetKind kind = DatasetKind.forKey(p[0], p[1]);
                FileGranularity g = FileGranularity.fromSegment(p[2]);
                if ((g == FileGranularity.DAILY) != (p.length == 9)) {
                    throw new IllegalArgumentException("granularity " + g + " does not match segment count");
                }
                int day = g == FileGranularity.DAILY ? Integer.parseInt(p[7]) : 0;
                key = new PartitionKey(kind, p[4], g, p[3], Integer.parseInt(p[5]), Integer.parseInt(p[6]), day);
            }
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Not a partition key: " + path + " (" + e.getMessage() + ")", e);
        }
        if (key == null || !key.path().equals(path)) {
            throw new IllegalArgumentException("Not a partition key: " + path);
        }
        return key;
    }

    @Override
    public int compareTo(PartitionKey o) {
        return path().compareTo(o.path());
    }

    @Override
    public String toString() { return path(); }
}
