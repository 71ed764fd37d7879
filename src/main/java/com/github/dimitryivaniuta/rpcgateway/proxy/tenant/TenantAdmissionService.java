package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.rpcgateway.proxy.support.TokenMasking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Registry of per-tenant {@link TenantLimiter} actors.
 *
 * <p>Actors live in a bounded Caffeine cache and expire after a period of inactivity. Removal
 * retires the actor inside the cache's atomic removal, so at most one live actor exists per tenant.
 * The retired actor flushes its pending usage and leaves a {@link TenantHandoff} that seeds the
 * next actor for the same token: a reload keeps the bucket level and never counts behind a
 * snapshot still queued for the database. Different tenants never share a lock.
 */
@Slf4j
@Service
public class TenantAdmissionService {

    private final TenantAccountRepository repository;
    private final TenantUsageWriter usageWriter;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final ZoneId monthZone;
    private final double burstMultiplier;
    private final Cache<String, TenantLimiter> limiters;
    private final Cache<String, TenantHandoff> handoffs;

    public TenantAdmissionService(TenantAccountRepository repository,
                                  TenantUsageWriter usageWriter,
                                  GatewayMetrics metrics,
                                  RpcGatewayProperties props,
                                  Clock clock) {
        this.repository = repository;
        this.usageWriter = usageWriter;
        this.metrics = metrics;
        this.clock = clock;

        RpcGatewayProperties.Admission cfg = props.getAdmission();
        this.monthZone = ZoneId.of(cfg.getMonthZone());
        this.burstMultiplier = cfg.getBurstMultiplier();
        if (!(burstMultiplier >= 1d)) {
            throw new IllegalArgumentException("rpc-gateway.admission.burst-multiplier must be >= 1");
        }

        // one entry per provisioned tenant at most; unknown tokens never leave a handoff
        this.handoffs = Caffeine.newBuilder()
                .expireAfterWrite(cfg.getSessionIdleTimeout())
                .executor(Runnable::run)
                .build();
        this.limiters = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxSessions())
                .expireAfterAccess(cfg.getSessionIdleTimeout())
                .executor(Runnable::run) // flush hand-off only enqueues; no need for another pool
                .evictionListener((String token, TenantLimiter limiter, RemovalCause cause) -> retire(token, limiter))
                .build();
    }

    public AdmissionDecision checkLimit(String token) {
        Optional<AdmissionDecision> outcome;
        do {
            // an actor retired between lookup and lock hands over to a fresh one
            outcome = limiters.get(token, this::newLimiter).tryCheckLimit();
        } while (outcome.isEmpty());
        AdmissionDecision decision = outcome.get();
        metrics.admission(decision.allowed() ? "allowed" : decision.reason().errorType().code());
        return decision;
    }

    /** Drops the cached actor so the next call reloads the record (after provisioning, plan change). */
    public void invalidate(String token) {
        limiters.asMap().computeIfPresent(token, (key, limiter) -> {
            retire(key, limiter);
            return null;
        });
    }

    /** Runs pending expirations so idle actors are flushed promptly. */
    public void sweep() {
        limiters.cleanUp();
    }

    public long activeSessions() {
        return limiters.estimatedSize();
    }

    private void retire(String token, TenantLimiter limiter) {
        if (limiter == null) return;
        TenantHandoff handoff = limiter.retire();
        if (handoff != null) {
            handoffs.put(token, handoff);
            log.debug("Retired limiter for tenant {}", TokenMasking.mask(token));
        }
    }

    private TenantLimiter newLimiter(String token) {
        TenantHandoff seed = handoffs.asMap().remove(token);
        return new TenantLimiter(token, repository, usageWriter, clock, monthZone, burstMultiplier, seed);
    }
}
