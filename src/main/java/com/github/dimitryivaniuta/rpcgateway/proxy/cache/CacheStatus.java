package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

/**
 * Cache outcome of one call. HIT and MISS are echoed in the X-Rpc-Cache response header;
 * BYPASS (not cacheable) and NONE (no parseable call) leave the header off.
 */
public enum CacheStatus {
    HIT, MISS, BYPASS, NONE;

    public boolean exposedInHeader() {
        return this == HIT || this == MISS;
    }
}
