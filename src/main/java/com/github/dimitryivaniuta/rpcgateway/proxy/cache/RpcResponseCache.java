package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.github.dimitryivaniuta.rpcgateway.proxy.dispatch.UpstreamResponse;

import java.util.Optional;

/**
 * Shared response store with TTL expiry and last-write-wins semantics.
 * Implementations absorb their own I/O errors: a failed lookup is a miss, a failed store is dropped.
 */
public interface RpcResponseCache {

    Optional<CachedRpcResponse> lookup(RpcCacheKey key, long ttlSeconds);

    /** Fire-and-forget; {@code ttlSeconds <= 0} is a no-op. */
    void store(RpcCacheKey key, UpstreamResponse response, long ttlSeconds);
}
