package com.github.dimitryivaniuta.rpcgateway.proxy.metrics;

import com.github.dimitryivaniuta.rpcgateway.proxy.cache.CacheStatus;

/**
 * Structured record of one proxied call. Carries no client address and no bearer token.
 * {@code errorType} is null for a successful call.
 */
public record RpcRequestEvent(
        String chain,
        String method,
        CacheStatus cacheStatus,
        UserType userType,
        int statusCode,
        long latencyMs,
        long requestSize,
        long responseSize,
        String errorType
) {

    public enum UserType {
        PUBLIC, AUTHENTICATED;

        public String tag() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }
}
