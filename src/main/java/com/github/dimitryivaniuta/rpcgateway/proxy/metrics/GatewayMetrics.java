package com.github.dimitryivaniuta.rpcgateway.proxy.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters of the gateway. Tags stay low-cardinality: chain slugs, cache categories
 * and outcome codes only, never RPC method names taken from the request body.
 */
@Component
public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Admission ----
    public void admission(String outcome) {
        Counter.builder("rpc_gateway_admission_total")
                .tag("outcome", outcome) // allowed | tenant_not_found | monthly_limit_exceeded | rate_limit_exceeded
                .register(registry)
                .increment();
    }

    public void publicRateLimited() {
        Counter.builder("rpc_gateway_public_ratelimit_rejected_total")
                .register(registry)
                .increment();
    }

    // ---- Cache ----
    public void cacheLookup(String chain, String category, boolean hit) {
        Counter.builder(hit ? "rpc_gateway_cache_hits_total" : "rpc_gateway_cache_misses_total")
                .tag("chain", chain)
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void cacheWriteFailed() {
        Counter.builder("rpc_gateway_cache_write_failures_total")
                .register(registry)
                .increment();
    }

    // ---- Upstream ----
    public void upstreamResponse(String chain, int status) {
        Counter.builder("rpc_gateway_upstream_responses_total")
                .tag("chain", chain)
                .tag("status", (status / 100) + "xx")
                .register(registry)
                .increment();
    }

    public void upstreamFailure(String chain) {
        Counter.builder("rpc_gateway_upstream_failures_total")
                .tag("chain", chain)
                .register(registry)
                .increment();
    }

    // ---- Write-behind ----
    public void usageWriteDropped() {
        Counter.builder("rpc_gateway_usage_writes_dropped_total")
                .register(registry)
                .increment();
    }

    public void usageWriteFailed() {
        Counter.builder("rpc_gateway_usage_write_failures_total")
                .register(registry)
                .increment();
    }

    // ---- Requests ----
    public void request(String chain, String userType, String cacheStatus, int status) {
        Counter.builder("rpc_gateway_requests_total")
                .tag("chain", chain)
                .tag("user_type", userType)
                .tag("cache", cacheStatus)
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }

    public void recordDuration(String chain, String cacheStatus, long nanos) {
        Timer.builder("rpc_gateway_request_duration")
                .tag("chain", chain)
                .tag("cache", cacheStatus)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
