package io.marketlake.marketdata;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * One caller-level ask for a range of a dataset, before fan-out. Immutable; build with {@link #builder(DatasetKind)}.
 * <p>
 * {@code start} and {@code end} are inclusive calendar dates. A request with a start and no end covers the rest of
 * the start's month. Earnings requests are month-based: use {@link Builder#months(YearMonth, YearMonth)}.
 * Range validation is left to {@link PartitionAddressing} so that reads and writes fail the same way.
 */
public final class LogicalRequest {
    public static final long DEFAULT_INTERVAL_MS = 3_600_000L;

    private final UUID id;
    private final DatasetKind kind;
    private final String symbol;
    private final LocalDate start;
    private final LocalDate end;
    private final boolean all;
    private final long intervalMs;
    private final int expiration;
    private final FileGranularity granularity;
    private final boolean forceRefresh;

    private LogicalRequest(Builder b) {
        this.id = b.id == null ? UUID.randomUUID() : b.id;
        this.kind = b.kind;
        this.symbol = b.symbol;
        this.start = b.start;
        this.end = b.end;
        this.all = b.all;
        this.intervalMs = b.intervalMs;
        this.expiration = b.expiration;
        this.granularity = b.granularity;
        this.forceRefresh = b.forceRefresh;
    }

    public static Builder builder(DatasetKind kind) {
        return new Builder(kind);
    }

    public UUID id() { return id; }
    public DatasetKind kind() { return kind; }
    /** Upper-case root symbol; null for earnings. */
    public String symbol() { return symbol; }
    public LocalDate start() { return start; }
    public LocalDate end() { return end; }
    public boolean all() { return all; }
    public long intervalMs() { return intervalMs; }
    public int expiration() { return expiration; }
    public FileGranularity granularity() { return granularity; }
    public boolean forceRefresh() { return forceRefresh; }

    /** The inclusive end date, defaulting to the last day of the start's month. */
    public LocalDate effectiveEnd() {
        if (end != null) return end;
        return start == null ? null : YearMonth.from(start).atEndOfMonth();
    }

    /** Partition-key interval segment: {@code 1d} for EOD kinds, otherwise the human form of the bar interval. */
    public String intervalLabel() {
        return PartitionAddressing.intervalLabel(kind, intervalMs);
    }

    @Override
    public String toString() {
        return "LogicalRequest{" +
                "id=" + id +
                ", kind=" + kind +
                (symbol == null ? "" : ", symbol=" + symbol) +
                (all ? ", all" : ", start=" + start + ", end=" + effectiveEnd()) +
                ", interval=" + intervalLabel() +
                ", granularity=" + granularity +
                (forceRefresh ? ", forceRefresh" : "") +
                '}';
    }

    public static final class Builder {
        private final DatasetKind kind;
        private UUID id;
        private String symbol;
        private LocalDate start;
        private LocalDate end;
        private boolean all;
        private long intervalMs = DEFAULT_INTERVAL_MS;
        private int expiration;
        private FileGranularity granularity = FileGranularity.MONTHLY;
        private boolean forceRefresh;

        private Builder(DatasetKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder id(UUID id) { this.id = id; return this; }

        public Builder symbol(String symbol) {
            this.symbol = symbol == null ? null : symbol.trim().toUpperCase(Locale.ROOT);
            return this;
        }

        public Builder start(LocalDate start) { this.start = start; return this; }
        public Builder end(LocalDate end) { this.end = end; return this; }

        public Builder range(LocalDate start, LocalDate end) {
            this.start = start;
            this.end = end;
            return this;
        }

        /** Whole months, first day of {@code from} through the last day of {@code to}. */
        public Builder months(YearMonth from, YearMonth to) {
            this.start = from == null ? null : from.atDay(1);
            this.end = to == null ? null : to.atEndOfMonth();
            return this;
        }

        /** Every stored partition for the symbol. Only valid for retrieval. */
        public Builder all(boolean all) { this.all = all; return this; }

        public Builder intervalMs(long intervalMs) { this.intervalMs = intervalMs; return this; }
        public Builder expiration(int expiration) { this.expiration = expiration; return this; }

        public Builder granularity(FileGranularity granularity) {
            this.granularity = Objects.requireNonNull(granularity, "granularity");
            return this;
        }

        public Builder forceRefresh(boolean forceRefresh) { this.forceRefresh = forceRefresh; return this; }

        public LogicalRequest build() {
            if (kind.hasSymbol()) {
                if (symbol == null || symbol.isEmpty()) {
                    throw new IllegalArgumentException(kind + " requests need a symbol");
                }
                if (symbol.contains("/") || symbol.contains("*")) {
                    throw new IllegalArgumentException("Illegal symbol: " + symbol);
                }
            } else {
                symbol = null;
            }
            if (kind == DatasetKind.EARNINGS && granularity != FileGranularity.MONTHLY) {
                throw new IllegalArgumentException("Earnings are only stored monthly");
            }
            if (intervalMs < 0) throw new IllegalArgumentException("intervalMs must be >= 0 but was " + intervalMs);
            if (expiration < 0) throw new IllegalArgumentException("expiration must be >= 0 but was " + expiration);
            return new LogicalRequest(this);
        }
    }
}
