package com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.GatewayMetrics;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Per-address limiter for the unauthenticated path. One Resilience4j limiter per client address,
 * held in a bounded Caffeine map so the key space cannot grow without limit.
 */
@Component
public class PublicRateLimiter {

    private static final Duration REFRESH_PERIOD = Duration.ofSeconds(1);

    private final boolean enabled;
    private final RateLimiterConfig config;
    private final Cache<String, RateLimiter> limiters;
    private final GatewayMetrics metrics;

    public PublicRateLimiter(RpcGatewayProperties props, GatewayMetrics metrics) {
        RpcGatewayProperties.PublicLimit cfg = props.getPublicLimit();
        this.enabled = cfg.isEnabled();
        this.metrics = metrics;
        this.config = RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, cfg.getRequestsPerSecond()))
                .limitRefreshPeriod(REFRESH_PERIOD)
                .timeoutDuration(Duration.ZERO) // fail fast
                .build();
        this.limiters = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxTrackedClients())
                .expireAfterAccess(Duration.ofMinutes(10))
                .build();
    }

    /** @throws RateLimitExceededException when the address has used up its permits for this second */
    public void acquire(String clientAddress) {
        if (!enabled) return;
        RateLimiter limiter = limiters.get(clientAddress, k -> RateLimiter.of("public", config));
        if (!limiter.acquirePermission()) {
            metrics.publicRateLimited();
            throw new RateLimitExceededException("Rate Limit Exceeded", retryAfterSeconds());
        }
    }

    private static long retryAfterSeconds() {
        long s = REFRESH_PERIOD.toSeconds();
        return (s <= 0) ? 1L : s;
    }
}
