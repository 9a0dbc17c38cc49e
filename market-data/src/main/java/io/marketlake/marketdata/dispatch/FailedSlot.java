package io.marketlake.marketdata.dispatch;

import java.net.URI;

public record FailedSlot(int slot, URI uri, String reason) {}
