package io.marketlake.marketdata;

import java.net.URI;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * One network fetch of a fan-out, fully resolved. {@code slot} is its index in the parent job.
 */
public record SubRequest(URI uri,
                         Map<String, String> headers,
                         DatasetKind kind,
                         PartitionKey partitionKey,
                         int slot,
                         LocalDate tradingDate,
                         Leg leg) {
    public SubRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(leg, "leg");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    @Override
    public String toString() {
        return "SubRequest{slot=" + slot + ", " + leg + " " + tradingDate + ", uri=" + uri + '}';
    }
}
