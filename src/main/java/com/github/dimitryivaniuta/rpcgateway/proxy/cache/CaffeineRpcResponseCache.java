package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.github.dimitryivaniuta.rpcgateway.config.AsyncConfig;
import com.github.dimitryivaniuta.rpcgateway.proxy.dispatch.UpstreamResponse;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link RpcResponseCache} on top of {@link TtlCaffeineCacheManager}: every TTL class maps to its own
 * Caffeine cache ({@code rpcResponses:ttl=N}), so expiry is exact per entry.
 */
@Slf4j
@Component
public class CaffeineRpcResponseCache implements RpcResponseCache {

    static final String CACHE_BASE_NAME = "rpcResponses";

    private final CacheManager cacheManager;
    private final Executor writer;
    private final GatewayMetrics metrics;

    public CaffeineRpcResponseCache(CacheManager cacheManager,
                                    @Qualifier(AsyncConfig.CACHE_WRITER_EXECUTOR) Executor writer,
                                    GatewayMetrics metrics) {
        this.cacheManager = cacheManager;
        this.writer = writer;
        this.metrics = metrics;
    }

    @Override
    public Optional<CachedRpcResponse> lookup(RpcCacheKey key, long ttlSeconds) {
        if (ttlSeconds <= 0) return Optional.empty();
        try {
            Cache cache = cacheManager.getCache(TtlCaffeineCacheManager.cacheName(CACHE_BASE_NAME, ttlSeconds));
            return cache == null
                    ? Optional.empty()
                    : Optional.ofNullable(cache.get(key.value(), CachedRpcResponse.class));
        } catch (RuntimeException ex) {
            log.warn("Cache lookup failed for {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(RpcCacheKey key, UpstreamResponse response, long ttlSeconds) {
        if (ttlSeconds <= 0) return;
        try {
            writer.execute(() -> put(key, response, ttlSeconds));
        } catch (RejectedExecutionException ex) {
            log.warn("Cache write queue full, dropping entry {}", key);
            metrics.cacheWriteFailed();
        }
    }

    void put(RpcCacheKey key, UpstreamResponse response, long ttlSeconds) {
        try {
            Cache cache = cacheManager.getCache(TtlCaffeineCacheManager.cacheName(CACHE_BASE_NAME, ttlSeconds));
            if (cache == null) return;
            cache.put(key.value(), toEntry(response, ttlSeconds));
        } catch (RuntimeException ex) {
            log.warn("Cache write failed for {}: {}", key, ex.getMessage());
            metrics.cacheWriteFailed();
        }
    }

    /** Only the content type survives; Set-Cookie and any other upstream header are dropped. */
    static CachedRpcResponse toEntry(UpstreamResponse response, long ttlSeconds) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (response.contentType() != null) {
            headers.put(HttpHeaders.CONTENT_TYPE, response.contentType());
        }
        headers.put(HttpHeaders.CACHE_CONTROL, "public, max-age=" + ttlSeconds);
        return new CachedRpcResponse(response.status(), Map.copyOf(headers), response.body(), ttlSeconds);
    }
}
