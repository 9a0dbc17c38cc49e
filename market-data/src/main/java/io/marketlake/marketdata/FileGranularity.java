package io.marketlake.marketdata;

import java.util.Locale;

/** How many trading days one stored partition covers. */
public enum FileGranularity {
    MONTHLY,
    DAILY;

    public String segment() { return name().toLowerCase(Locale.ROOT); }

    public static FileGranularity fromSegment(String s) {
        return valueOf(s.toUpperCase(Locale.ROOT));
    }
}
