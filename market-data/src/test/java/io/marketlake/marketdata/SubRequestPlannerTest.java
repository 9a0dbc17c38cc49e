package io.marketlake.marketdata;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubRequestPlannerTest {
    private final SubRequestPlanner planner = new SubRequestPlanner("http://127.0.0.1:25510/v2/", "https://api.nasdaq.com/api/calendar/earnings");

    @Test
    void optionDaysFetchContractsThenUnderlying() {
        LogicalRequest r = LogicalRequest.builder(DatasetKind.OPTION_EOD).symbol("SPY")
                .range(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3)).build();
        List<SubRequest> subs = planner.plan(r, Set.of()).subRequests();
        assertEquals(4, subs.size());
        for (int i = 0; i < subs.size(); i++) assertEquals(i, subs.get(i).slot());

        assertEquals(Leg.CONTRACTS, subs.get(0).leg());
        assertEquals(URI.create("http://127.0.0.1:25510/v2/bulk_hist/option/eod?root=SPY&exp=0&use_csv=true&start_date=20240102&end_date=20240102"),
                subs.get(0).uri());
        assertEquals(Leg.UNDERLYING, subs.get(1).leg());
        assertEquals(URI.create("http://127.0.0.1:25510/v2/hist/stock/eod?root=SPY&use_csv=true&start_date=20240102&end_date=20240102"),
                subs.get(1).uri());
        assertEquals(LocalDate.of(2024, 1, 3), subs.get(2).tradingDate());
        assertEquals(subs.get(0).partitionKey(), subs.get(3).partitionKey());
    }

    @Test
    void quoteRequestsCarryTheInterval() {
        LogicalRequest r = LogicalRequest.builder(DatasetKind.STOCK_QUOTE).symbol("AAPL").intervalMs(60_000)
                .range(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 5)).build();
        SubRequest only = planner.plan(r, Set.of()).subRequests().get(0);
        assertEquals("root=AAPL&ivl=60000&use_csv=true&start_date=20240105&end_date=20240105", only.uri().getQuery());
        assertEquals(Leg.SINGLE, only.leg());
    }

    @Test
    void storedPartitionsAreSkippedUnlessForced() {
        LogicalRequest r = LogicalRequest.builder(DatasetKind.STOCK_EOD).symbol("SPY")
                .range(LocalDate.of(2023, 12, 28), LocalDate.of(2024, 1, 3)).build();
        List<PartitionKey> keys = PartitionAddressing.keysFor(r);
        SubRequestPlanner.Expansion e = planner.plan(r, Set.of(keys.get(0)));
        assertEquals(List.of(keys.get(0)), e.skipped());
        assertEquals(List.of(keys.get(1)), e.keys());
        assertEquals(2, e.subRequests().size()); // Jan 2, Jan 3

        LogicalRequest forced = LogicalRequest.builder(DatasetKind.STOCK_EOD).symbol("SPY").forceRefresh(true)
                .range(LocalDate.of(2023, 12, 28), LocalDate.of(2024, 1, 3)).build();
        assertEquals(4, planner.plan(forced, Set.of(keys.get(0))).subRequests().size()); // Dec 28, 29, Jan 2, 3
    }

    @Test
    void earningsCoverWholeMonthsWithBrowserHeaders() {
        LogicalRequest r = LogicalRequest.builder(DatasetKind.EARNINGS).months(YearMonth.of(2024, 1), YearMonth.of(2024, 2)).build();
        SubRequestPlanner.Expansion e = planner.plan(r, Set.of());
        assertEquals(2, e.keys().size());
        assertEquals(21 + 20, e.subRequests().size());
        SubRequest first = e.subRequests().get(0);
        assertEquals(URI.create("https://api.nasdaq.com/api/calendar/earnings?date=2024-01-02"), first.uri());
        assertTrue(first.headers().containsKey("User-Agent"));
        SubRequest last = e.subRequests().get(e.subRequests().size() - 1);
        assertEquals(LocalDate.of(2024, 2, 29), last.tradingDate());
    }

    @Test
    void weekendOnlyRangeIsEmpty() {
        LogicalRequest r = LogicalRequest.builder(DatasetKind.STOCK_EOD).symbol("SPY")
                .range(LocalDate.of(2024, 1, 6), LocalDate.of(2024, 1, 7)).build();
        assertTrue(planner.plan(r, Set.of()).isEmpty());
    }
}
