package io.marketlake.marketdata;

public enum ContentType {
    CSV,
    JSON;

    public static ContentType forKind(DatasetKind kind) {
        return kind == DatasetKind.EARNINGS ? JSON : CSV;
    }
}
