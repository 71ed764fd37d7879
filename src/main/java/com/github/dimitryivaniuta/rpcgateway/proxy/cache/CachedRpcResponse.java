package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import java.util.Map;

/**
 * Stored upstream answer. Headers are already reduced to the non-identifying set
 * (content type, cache control).
 */
public record CachedRpcResponse(int status, Map<String, String> headers, byte[] body, long ttlSeconds) {}
