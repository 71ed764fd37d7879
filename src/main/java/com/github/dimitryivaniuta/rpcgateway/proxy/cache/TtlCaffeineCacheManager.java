package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager with one cache per TTL class, selected by name:
 *
 *   "rpcResponses:ttl=900"  -> expireAfterWrite 900 seconds (static data)
 *   "rpcResponses:ttl=3"    -> expireAfterWrite 3 seconds (head-of-chain data)
 *
 * Names without ":ttl=" keep the base builder's expiry.
 *
 * Caffeine builders are mutable, so every cache gets a fresh builder from the supplier.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_PATTERN = Pattern.compile("^(?<base>.+?)(?::ttl=(?<ttl>\\d+))?$");
    private static final long MIN_TTL_SECONDS = 1;
    private static final long MAX_TTL_SECONDS = 24 * 60 * 60;

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;
    private final Map<String, Cache> cacheMap = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
    }

    /** Builds the name of the cache holding entries of the given TTL, e.g. {@code rpcResponses:ttl=300}. */
    public static String cacheName(String base, long ttlSeconds) {
        return base + ":ttl=" + clamp(ttlSeconds, MIN_TTL_SECONDS, MAX_TTL_SECONDS);
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    private Cache createCache(String name) {
        Long ttlSeconds = parseTtl(name);
        Caffeine<Object, Object> builder = baseBuilderFactory.get();
        if (ttlSeconds != null) {
            builder = builder.expireAfterWrite(Duration.ofSeconds(ttlSeconds));
        }
        // null values are never stored: a missing response is not a cacheable answer
        return new CaffeineCache(name, builder.build(), false);
    }

    private static Long parseTtl(String name) {
        if (name == null || name.isBlank()) return null;

        Matcher m = TTL_PATTERN.matcher(name.trim());
        if (!m.matches() || m.group("ttl") == null) return null;

        try {
            return clamp(Long.parseLong(m.group("ttl")), MIN_TTL_SECONDS, MAX_TTL_SECONDS);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        return Math.min(v, max);
    }
}
