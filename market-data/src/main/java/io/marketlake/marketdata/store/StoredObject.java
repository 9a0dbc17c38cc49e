package io.marketlake.marketdata.store;

public record StoredObject(String key, long size) {}
