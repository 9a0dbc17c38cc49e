package io.marketlake.marketdata.upstream;

import io.marketlake.marketdata.RawPayload;
import io.marketlake.marketdata.SubRequest;

@FunctionalInterface
public interface UpstreamClient {
    RawPayload fetch(SubRequest request) throws FetchException;
}
