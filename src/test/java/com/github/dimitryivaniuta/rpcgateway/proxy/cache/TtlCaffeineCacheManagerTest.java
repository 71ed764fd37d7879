package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TtlCaffeineCacheManagerTest {

    @Test
    void shouldCreateIndependentCachesPerTtlClass() {
        CacheManager cm = new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(10_000)
                        .expireAfterAccess(Duration.ofMinutes(5))
        );

        Cache staticCache = cm.getCache("rpcResponses:ttl=900");
        Cache volatileCache = cm.getCache("rpcResponses:ttl=3");

        assertThat(staticCache).isNotNull();
        assertThat(volatileCache).isNotNull();
        assertThat(staticCache.getName()).isEqualTo("rpcResponses:ttl=900");

        staticCache.put("rpc:eth:abc", "v1");
        assertThat(staticCache.get("rpc:eth:abc", String.class)).isEqualTo("v1");
        assertThat(volatileCache.get("rpc:eth:abc")).isNull();
    }

    @Test
    void shouldReturnSameCacheInstanceForSameName() {
        CacheManager cm = new TtlCaffeineCacheManager(() -> Caffeine.newBuilder().maximumSize(10_000));

        assertThat(cm.getCache("rpcResponses:ttl=300")).isSameAs(cm.getCache("rpcResponses:ttl=300"));
    }

    @Test
    void cacheNameClampsTtlIntoSupportedRange() {
        assertThat(TtlCaffeineCacheManager.cacheName("rpcResponses", 300)).isEqualTo("rpcResponses:ttl=300");
        assertThat(TtlCaffeineCacheManager.cacheName("rpcResponses", 0)).isEqualTo("rpcResponses:ttl=1");
        assertThat(TtlCaffeineCacheManager.cacheName("rpcResponses", 10_000_000)).isEqualTo("rpcResponses:ttl=86400");
    }
}
