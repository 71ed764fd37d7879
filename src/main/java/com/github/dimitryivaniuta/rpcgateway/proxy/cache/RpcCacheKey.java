package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

/**
 * Chain-namespaced response cache key; {@code fingerprint} is the lowercase SHA-256 hex
 * of the canonical {method, params} form.
 */
public record RpcCacheKey(String chain, String fingerprint) {

    public String value() {
        return "rpc:" + chain + ":" + fingerprint;
    }

    @Override
    public String toString() {
        return value();
    }
}
