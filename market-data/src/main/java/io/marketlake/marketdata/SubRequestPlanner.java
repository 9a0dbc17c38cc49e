package io.marketlake.marketdata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a logical request into ordered sub-requests: per partition key in time order, per trading day, per leg.
 * Option days fetch the contracts leg and then the underlying stock leg. Slots are assigned in that order.
 */
public class SubRequestPlanner {
    private static final Logger log = LoggerFactory.getLogger(SubRequestPlanner.class);
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    /** Headers the earnings calendar expects from a browser. */
    public static final Map<String, String> EARNINGS_HEADERS = Map.of(
            "Accept", "application/json, text/plain, */*",
            "User-Agent", "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/83.0.4103.116 Safari/537.36",
            "Origin", "https://www.nasdaq.com",
            "Referer", "https://www.nasdaq.com/",
            "Accept-Language", "en-US,en;q=0.9");

    private final String upstreamUrl;
    private final String earningsUrl;

    public SubRequestPlanner(String upstreamUrl, String earningsUrl) {
        this.upstreamUrl = stripSlash(upstreamUrl);
        this.earningsUrl = stripSlash(earningsUrl);
    }

    /** Result of expanding one request. {@code skipped} are keys left alone because they are already stored. */
    public record Expansion(List<SubRequest> subRequests, List<PartitionKey> keys, List<PartitionKey> skipped) {
        public boolean isEmpty() { return subRequests.isEmpty(); }
    }

    public Expansion plan(LogicalRequest request, Set<PartitionKey> alreadyStored) {
        List<PartitionKey> all = PartitionAddressing.keysFor(request);
        if (!request.kind().isEod() && request.kind() != DatasetKind.EARNINGS
                && request.intervalMs() != 60_000L && request.intervalMs() != 3_600_000L) {
            log.warn("Interval {}ms is not 1m or 1h; the provider is slow to serve it", request.intervalMs());
        }
        LocalDate start = request.start();
        LocalDate end = request.effectiveEnd();

        List<SubRequest> out = new ArrayList<>();
        List<PartitionKey> planned = new ArrayList<>();
        List<PartitionKey> skipped = new ArrayList<>();
        for (PartitionKey key : all) {
            if (!request.forceRefresh() && alreadyStored.contains(key)) {
                skipped.add(key);
                continue;
            }
            List<LocalDate> days = daysFor(key, start, end);
            if (days.isEmpty()) continue;
            planned.add(key);
            for (LocalDate day : days) {
                if (request.kind().isOption()) {
                    out.add(new SubRequest(optionUri(request, day), Map.of(), request.kind(), key, out.size(), day, Leg.CONTRACTS));
                    out.add(new SubRequest(stockUri(request, day), Map.of(), request.kind(), key, out.size(), day, Leg.UNDERLYING));
                } else if (request.kind().isStock()) {
                    out.add(new SubRequest(stockUri(request, day), Map.of(), request.kind(), key, out.size(), day, Leg.SINGLE));
                } else {
                    out.add(new SubRequest(earningsUri(day), EARNINGS_HEADERS, request.kind(), key, out.size(), day, Leg.SINGLE));
                }
            }
        }
        log.debug("Planned {} sub-requests over {} partitions for {} ({} already stored)",
                out.size(), planned.size(), request.id(), skipped.size());
        return new Expansion(List.copyOf(out), List.copyOf(planned), List.copyOf(skipped));
    }

    private static List<LocalDate> daysFor(PartitionKey key, LocalDate start, LocalDate end) {
        if (key.granularity() == FileGranularity.DAILY) {
            return List.of(LocalDate.of(key.year(), key.month(), key.day()));
        }
        YearMonth ym = key.yearMonth();
        LocalDate from = start.isAfter(ym.atDay(1)) ? start : ym.atDay(1);
        LocalDate to = end.isBefore(ym.atEndOfMonth()) ? end : ym.atEndOfMonth();
        return TradingCalendars.tradingDays(from, to);
    }

    URI stockUri(LogicalRequest r, LocalDate day) {
        StringBuilder q = new StringBuilder();
        q.append("root=").append(enc(r.symbol()));
        if (!r.kind().isEod()) q.append("&ivl=").append(r.intervalMs());
        q.append("&use_csv=true");
        appendDay(q, day);
        return URI.create(upstreamUrl + "/hist/stock/" + r.kind().endpoint() + "?" + q);
    }

    URI optionUri(LogicalRequest r, LocalDate day) {
        StringBuilder q = new StringBuilder();
        q.append("root=").append(enc(r.symbol()));
        q.append("&exp=").append(r.expiration());
        if (!r.kind().isEod()) q.append("&ivl=").append(r.intervalMs());
        q.append("&use_csv=true");
        appendDay(q, day);
        return URI.create(upstreamUrl + "/bulk_hist/option/" + r.kind().endpoint() + "?" + q);
    }

    URI earningsUri(LocalDate day) {
        return URI.create(earningsUrl + "?date=" + day);
    }

    private static void appendDay(StringBuilder q, LocalDate day) {
        String d = BASIC.format(day);
        q.append("&start_date=").append(d).append("&end_date=").append(d);
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
