package io.marketlake.marketdata;

import java.util.Locale;

/**
 * The series the system knows how to fetch and store. Each kind has exactly one canonical schema.
 */
public enum DatasetKind {
    OPTION_QUOTE("historical-options", "quote"),
    OPTION_EOD("historical-options", "eod"),
    STOCK_QUOTE("historical-stock", "quote"),
    STOCK_EOD("historical-stock", "eod"),
    EARNINGS("earnings", null);

    private final String prefix;
    private final String endpoint;

    DatasetKind(String prefix, String endpoint) {
        this.prefix = prefix;
        this.endpoint = endpoint;
    }

    /** First segment of every partition key of this kind. */
    public String prefix() { return prefix; }

    /** Provider endpoint name ({@code quote} or {@code eod}); null for earnings. */
    public String endpoint() { return endpoint; }

    public boolean isOption() { return this == OPTION_QUOTE || this == OPTION_EOD; }
    public boolean isStock() { return this == STOCK_QUOTE || this == STOCK_EOD; }
    public boolean isEod() { return "eod".equals(endpoint); }
    public boolean hasSymbol() { return this != EARNINGS; }

    /** The stock series an option kind is paired with. */
    public DatasetKind underlying() {
        switch (this) {
            case OPTION_QUOTE: return STOCK_QUOTE;
            case OPTION_EOD: return STOCK_EOD;
            default: throw new IllegalArgumentException(this + " has no underlying series");
        }
    }

    /** Kebab-case name used on the command line, e.g. {@code option-eod}. */
    public String cliName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static DatasetKind fromCliName(String name) {
        for (DatasetKind k : values()) {
            if (k.cliName().equalsIgnoreCase(name) || k.name().equalsIgnoreCase(name)) return k;
        }
        throw new IllegalArgumentException("Unknown dataset kind: " + name);
    }

    static DatasetKind forKey(String prefix, String endpoint) {
        for (DatasetKind k : values()) {
            if (k.prefix.equals(prefix) && (k.endpoint == null || k.endpoint.equals(endpoint))) return k;
        }
        throw new IllegalArgumentException("No dataset kind for " + prefix + "/" + endpoint);
    }
}
