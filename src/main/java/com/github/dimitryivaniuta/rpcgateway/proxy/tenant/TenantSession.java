package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import com.github.dimitryivaniuta.rpcgateway.proxy.plan.PlanType;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * In-memory quota and bucket state of one tenant. Not thread-safe: only the owning
 * {@link TenantLimiter} touches it, and only while holding its lock.
 */
@Getter
final class TenantSession {

    private final String token;
    private final PlanType plan;
    private final double capacity;

    private long currentMonthRequests;
    private Instant monthResetAt;
    private double tokens;
    private Instant lastRefill;
    private boolean dirty;

    private TenantSession(String token, PlanType plan, double burstMultiplier,
                          long currentMonthRequests, Instant monthResetAt, Instant now) {
        this.token = token;
        this.plan = plan;
        this.capacity = burstMultiplier * plan.requestsPerSecond();
        this.currentMonthRequests = currentMonthRequests;
        this.monthResetAt = monthResetAt;
        this.tokens = plan.requestsPerSecond();
        this.lastRefill = now;
    }

    static TenantSession load(TenantAccount account, PlanType plan, double burstMultiplier, Instant now) {
        Instant resetAt = account.getMonthResetAt() != null ? account.getMonthResetAt() : now;
        return new TenantSession(account.getToken(), plan, burstMultiplier,
                account.getCurrentMonthRequests(), resetAt, now);
    }

    /** Resets the counter when (month, year) of the stored reset differs from now's. */
    boolean rollMonthIfNeeded(Instant now, ZoneId zone) {
        ZonedDateTime last = monthResetAt.atZone(zone);
        ZonedDateTime current = now.atZone(zone);
        if (last.getMonthValue() == current.getMonthValue() && last.getYear() == current.getYear()) {
            return false;
        }
        currentMonthRequests = 0;
        monthResetAt = now;
        dirty = true;
        return true;
    }

    boolean monthlyLimitReached() {
        return plan.hasMonthlyLimit() && currentMonthRequests >= plan.monthlyLimit();
    }

    void refill(Instant now) {
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos <= 0) return;
        double elapsedSeconds = elapsedNanos / 1_000_000_000d;
        tokens = Math.min(capacity, tokens + elapsedSeconds * plan.requestsPerSecond());
        lastRefill = now;
    }

    boolean hasToken() {
        return tokens >= 1d;
    }

    void consume() {
        tokens -= 1d;
        currentMonthRequests++;
        dirty = true;
    }

    long remaining() {
        return plan.remaining(currentMonthRequests);
    }

    /**
     * Continues from a predecessor's state. The bucket is clamped to this plan's capacity; the
     * counter is taken over only when it is ahead of the stored record.
     */
    void resume(TenantHandoff handoff) {
        tokens = Math.min(capacity, handoff.tokens());
        lastRefill = handoff.lastRefill();
        boolean ahead = handoff.monthResetAt().isAfter(monthResetAt)
                || (handoff.monthResetAt().equals(monthResetAt)
                && handoff.currentMonthRequests() > currentMonthRequests);
        if (ahead) {
            currentMonthRequests = handoff.currentMonthRequests();
            monthResetAt = handoff.monthResetAt();
            dirty = true;
        }
    }

    TenantHandoff handoff() {
        return new TenantHandoff(tokens, lastRefill, currentMonthRequests, monthResetAt);
    }

    UsageSnapshot snapshot() {
        return new UsageSnapshot(token, currentMonthRequests, monthResetAt);
    }

    void markClean() {
        dirty = false;
    }
}
