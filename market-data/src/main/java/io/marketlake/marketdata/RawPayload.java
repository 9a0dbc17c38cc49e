package io.marketlake.marketdata;

import java.net.URI;
import java.util.Objects;

/**
 * Untyped response body of one sub-request, tagged with the leg it answers. A {@code noData} payload stands for the
 * provider's explicit "no data for the specified timeframe" answer and carries no bytes.
 */
public final class RawPayload {
    private static final byte[] EMPTY = new byte[0];

    private final byte[] body;
    private final ContentType contentType;
    private final URI source;
    private final Leg leg;
    private final boolean noData;

    private RawPayload(byte[] body, ContentType contentType, URI source, Leg leg, boolean noData) {
        this.body = body == null ? EMPTY : body;
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.source = source;
        this.leg = Objects.requireNonNull(leg, "leg");
        this.noData = noData;
    }

    public static RawPayload of(byte[] body, ContentType contentType, URI source) {
        return of(body, contentType, source, Leg.SINGLE);
    }

    public static RawPayload of(byte[] body, ContentType contentType, URI source, Leg leg) {
        return new RawPayload(body, contentType, source, leg, false);
    }

    public static RawPayload noData(ContentType contentType, URI source) {
        return noData(contentType, source, Leg.SINGLE);
    }

    public static RawPayload noData(ContentType contentType, URI source, Leg leg) {
        return new RawPayload(EMPTY, contentType, source, leg, true);
    }

    public byte[] body() { return body; }
    public ContentType contentType() { return contentType; }
    public URI source() { return source; }
    public Leg leg() { return leg; }
    public boolean isNoData() { return noData; }

    /** True for no-data answers and bodies that are empty or only whitespace. */
    public boolean isEmpty() {
        if (noData) return true;
        for (byte b : body) {
            if (!Character.isWhitespace(b)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "RawPayload{" + contentType + ", " + body.length + " bytes, " + leg + ", source=" + source + (noData ? ", noData" : "") + '}';
    }
}
