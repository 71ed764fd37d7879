package com.github.dimitryivaniuta.rpcgateway.proxy.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    /** HIT or MISS; absent when the call was not cache-eligible. */
    public static final String CACHE_STATUS_HEADER = "X-Rpc-Cache";
    public static final String RETRY_AFTER_HEADER = "Retry-After";
}
