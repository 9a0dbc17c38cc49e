package io.marketlake.marketdata;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure mapping from a logical request to the partition keys it writes, and to the glob patterns it reads.
 * All range validation happens here, before any network or storage access.
 */
public final class PartitionAddressing {
    private PartitionAddressing() {}

    /**
     * Keys covering {@code [start, end]}, ascending. Monthly granularity walks calendar months inclusively;
     * daily granularity walks trading days. A null {@code end} means the rest of the start's month.
     */
    public static List<PartitionKey> keysFor(DatasetKind kind, String symbol, LocalDate start, LocalDate end,
                                             FileGranularity granularity, String interval) {
        if (start == null) throw new InvalidRangeException("A start date is required for " + kind);
        LocalDate last = end == null ? YearMonth.from(start).atEndOfMonth() : end;
        if (last.isBefore(start)) {
            throw new InvalidRangeException("End " + last + " is before start " + start);
        }
        List<PartitionKey> keys = new ArrayList<>();
        if (granularity == FileGranularity.DAILY) {
            for (LocalDate d : TradingCalendars.tradingDays(start, last)) {
                keys.add(PartitionKey.daily(kind, symbol, interval, d));
            }
            return keys;
        }
        YearMonth to = YearMonth.from(last);
        for (YearMonth ym = YearMonth.from(start); !ym.isAfter(to); ym = ym.plusMonths(1)) {
            keys.add(kind == DatasetKind.EARNINGS
                    ? PartitionKey.earnings(ym)
                    : PartitionKey.monthly(kind, symbol, interval, ym));
        }
        return keys;
    }

    /** Write-path expansion. {@code all} requests are rejected. */
    public static List<PartitionKey> keysFor(LogicalRequest request) {
        if (request.all()) {
            throw new InvalidRangeException("'all' selects stored partitions and cannot be ingested");
        }
        return keysFor(request.kind(), request.symbol(), request.start(), request.end(),
                request.granularity(), request.intervalLabel());
    }

    /**
     * Read-path expansion: one pattern per key, or a single wildcard pattern in {@code all} mode.
     */
    public static List<String> patternsFor(LogicalRequest request) {
        if (request.all()) {
            PartitionKey any = new PartitionKey(request.kind(), request.symbol(), request.granularity(),
                    request.intervalLabel(), 2000, 1, request.granularity() == FileGranularity.DAILY ? 1 : 0);
            String stars = request.granularity() == FileGranularity.DAILY ? "/*/*/*/" : "/*/*/";
            return List.of(any.prefix() + stars + PartitionKey.FILE_NAME);
        }
        if (request.start() == null) {
            throw new InvalidRangeException("Either a start date or 'all' is required");
        }
        List<String> patterns = new ArrayList<>();
        for (PartitionKey k : keysFor(request.kind(), request.symbol(), request.start(), request.end(),
                request.granularity(), request.intervalLabel())) {
            patterns.add(k.path());
        }
        return patterns;
    }

    public static String intervalLabel(DatasetKind kind, long intervalMs) {
        if (kind == DatasetKind.EARNINGS) return null;
        return kind.isEod() ? "1d" : humanInterval(intervalMs);
    }

    /** {@code tick}, {@code Ns}, {@code Nm}, {@code Nh} or {@code Nd}, truncating to the largest unit below the next. */
    public static String humanInterval(long intervalMs) {
        if (intervalMs <= 0) return "tick";
        if (intervalMs < 60_000L) return (intervalMs / 1_000L) + "s";
        if (intervalMs < 3_600_000L) return (intervalMs / 60_000L) + "m";
        if (intervalMs < 86_400_000L) return (intervalMs / 3_600_000L) + "h";
        return (intervalMs / 86_400_000L) + "d";
    }
}
