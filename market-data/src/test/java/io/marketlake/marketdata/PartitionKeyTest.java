package io.marketlake.marketdata;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class PartitionKeyTest {

    @Test
    void monthlyKeyFormatAndParse() {
        PartitionKey k = PartitionKey.monthly(DatasetKind.OPTION_QUOTE, "SPY", "1h", YearMonth.of(2024, 3));
        assertEquals("historical-options/quote/monthly/1h/SPY/2024/03/data.csv", k.path());
        assertEquals(k, PartitionKey.parse(k.path()));
    }

    @Test
    void keysUseAsciiDigitsWhateverTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("ar-SA-u-nu-arab"));
            PartitionKey k = PartitionKey.daily(DatasetKind.STOCK_EOD, "SPY", "1d", LocalDate.of(2024, 1, 5));
            assertEquals("historical-stock/eod/daily/1d/SPY/2024/01/05/data.csv", k.path());
            assertEquals("earnings/2024/01/data.csv", PartitionKey.earnings(YearMonth.of(2024, 1)).path());
            assertEquals(k, PartitionKey.parse(k.path()));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void dailyAndEarningsKeysRoundTrip() {
        PartitionKey daily = PartitionKey.daily(DatasetKind.STOCK_EOD, "AAPL", "1d", LocalDate.of(2024, 1, 5));
        assertEquals("historical-stock/eod/daily/1d/AAPL/2024/01/05/data.csv", daily.path());
        assertEquals(daily, PartitionKey.parse(daily.path()));

        PartitionKey earnings = PartitionKey.earnings(YearMonth.of(2025, 9));
        assertEquals("earnings/2025/09/data.csv", earnings.path());
        PartitionKey parsed = PartitionKey.parse("earnings/2025/09/data.csv");
        assertEquals(DatasetKind.EARNINGS, parsed.kind());
        assertNull(parsed.symbol());
        assertEquals(9, parsed.month());
    }

    @Test
    void yearRolloverRoundTrips() {
        var keys = PartitionAddressing.keysFor(DatasetKind.STOCK_EOD, "SPY",
                LocalDate.of(2023, 12, 1), LocalDate.of(2024, 1, 31), FileGranularity.MONTHLY, "1d");
        assertEquals(2, keys.size());
        assertEquals("historical-stock/eod/monthly/1d/SPY/2023/12/data.csv", keys.get(0).path());
        assertEquals("historical-stock/eod/monthly/1d/SPY/2024/01/data.csv", keys.get(1).path());
        for (PartitionKey k : keys) assertEquals(k, PartitionKey.parse(k.path()));
    }

    @Test
    void rejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> PartitionKey.parse("earnings/2025/9/data.csv"));
        assertThrows(IllegalArgumentException.class, () -> PartitionKey.parse("historical-stock/eod/monthly/1d/SPY/2024/01/data.parquet"));
        assertThrows(IllegalArgumentException.class, () -> PartitionKey.parse("historical-stock/eod/daily/1d/SPY/2024/01/data.csv"));
        assertThrows(IllegalArgumentException.class, () -> PartitionKey.parse("somewhere/else"));
    }
}
