package com.github.dimitryivaniuta.rpcgateway.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Local response cache: one Caffeine cache per TTL class ("rpcResponses:ttl=900", ...),
 * each bounded by rpc-gateway.cache.max-entries.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(RpcGatewayProperties props) {
        long maxEntries = props.getCache().getMaxEntries();
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(maxEntries)
                        .expireAfterAccess(Duration.ofMinutes(10)) // only for names without ":ttl="
                        .recordStats()
        );
    }
}
