package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

/** Coarse bucket of a TTL, used for log lines and metric tags. */
public enum CacheCategory {
    STATIC, VOLATILE, DYNAMIC, NEVER;

    public static CacheCategory of(long ttlSeconds, long staticThreshold, long volatileThreshold) {
        if (ttlSeconds >= staticThreshold) return STATIC;
        if (ttlSeconds >= volatileThreshold) return VOLATILE;
        if (ttlSeconds > 0) return DYNAMIC;
        return NEVER;
    }

    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
