package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import com.github.dimitryivaniuta.rpcgateway.proxy.plan.PlanType;
import com.github.dimitryivaniuta.rpcgateway.proxy.support.TokenMasking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer admission actor for one tenant.
 *
 * <p>Calls are serialized by a fair lock, so they are processed one at a time in arrival order.
 * The record is loaded lazily on the first call. Every admitted call consumes one bucket token and
 * one request of the monthly quota, then hands an absolute usage snapshot to the write-behind
 * {@link TenantUsageWriter}. The response never waits for persistence.
 *
 * <p>States: {@code UNINITIALIZED -> LOADED -> ACTIVE}, plus the terminal {@code NOT_FOUND}.
 * A failed load leaves the actor {@code UNINITIALIZED}, so the next call tries again.
 *
 * <p>Once {@link #retire() retired} by the registry the actor admits nothing more; its state is
 * carried into the successor through a {@link TenantHandoff}.
 */
public class TenantLimiter {

    private static final Logger log = LoggerFactory.getLogger(TenantLimiter.class);

    public enum State { UNINITIALIZED, LOADED, ACTIVE, NOT_FOUND }

    private final String token;
    private final TenantAccountRepository repository;
    private final TenantUsageWriter usageWriter;
    private final Clock clock;
    private final ZoneId monthZone;
    private final double burstMultiplier;

    private final ReentrantLock lock = new ReentrantLock(true);

    private final TenantHandoff seed;

    private State state = State.UNINITIALIZED;
    private TenantSession session;
    private boolean retired;

    public TenantLimiter(String token,
                         TenantAccountRepository repository,
                         TenantUsageWriter usageWriter,
                         Clock clock,
                         ZoneId monthZone,
                         double burstMultiplier) {
        this(token, repository, usageWriter, clock, monthZone, burstMultiplier, null);
    }

    TenantLimiter(String token,
                  TenantAccountRepository repository,
                  TenantUsageWriter usageWriter,
                  Clock clock,
                  ZoneId monthZone,
                  double burstMultiplier,
                  TenantHandoff seed) {
        this.token = token;
        this.repository = repository;
        this.usageWriter = usageWriter;
        this.clock = clock;
        this.monthZone = monthZone;
        this.burstMultiplier = burstMultiplier;
        this.seed = seed;
    }

    /** @throws IllegalStateException if the actor has been retired */
    public AdmissionDecision checkLimit() {
        return tryCheckLimit().orElseThrow(() -> new IllegalStateException("Limiter retired"));
    }

    /** Empty once retired: the caller must look up the successor. */
    Optional<AdmissionDecision> tryCheckLimit() {
        lock.lock();
        try {
            return retired ? Optional.empty() : Optional.of(admit());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops admission and flushes pending usage.
     *
     * @return the state to seed the successor with, or {@code null} if no record was loaded
     */
    TenantHandoff retire() {
        lock.lock();
        try {
            retired = true;
            if (session == null) return null;
            flushPending();
            return session.handoff();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private AdmissionDecision admit() {
        if (state == State.NOT_FOUND) {
            return AdmissionDecision.deny(DenialReason.TENANT_NOT_FOUND, 0);
        }
        if (state == State.UNINITIALIZED && !load()) {
            return AdmissionDecision.deny(DenialReason.TENANT_NOT_FOUND, 0);
        }

        Instant now = clock.instant();
        if (session.rollMonthIfNeeded(now, monthZone)) {
            log.info("Monthly usage reset for tenant {}", TokenMasking.mask(token));
        }

        if (session.monthlyLimitReached()) {
            flushIfDirty();
            return AdmissionDecision.deny(DenialReason.MONTHLY_LIMIT, 0);
        }

        session.refill(now);
        if (!session.hasToken()) {
            flushIfDirty();
            return AdmissionDecision.deny(DenialReason.RATE_LIMIT, 0);
        }

        session.consume();
        state = State.ACTIVE;
        flushIfDirty();
        return AdmissionDecision.allow(session.remaining());
    }

    /** Hands any unflushed usage to the writer. */
    public void flushPending() {
        lock.lock();
        try {
            if (session != null) flushIfDirty();
        } finally {
            lock.unlock();
        }
    }

    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Current bucket level, or NaN before the record is loaded. */
    public double tokens() {
        lock.lock();
        try {
            return session == null ? Double.NaN : session.getTokens();
        } finally {
            lock.unlock();
        }
    }

    private boolean load() {
        Optional<TenantAccount> found;
        try {
            found = repository.findById(token);
        } catch (DataAccessException ex) {
            log.warn("Tenant load failed for {}, will retry on next call: {}",
                    TokenMasking.mask(token), ex.getMessage());
            return false;
        }

        if (found.isEmpty()) {
            state = State.NOT_FOUND;
            log.info("Unknown tenant {}", TokenMasking.mask(token));
            return false;
        }

        TenantAccount account = found.get();
        PlanType plan = PlanType.fromId(account.getPlan()).orElseGet(() -> {
            log.warn("Tenant {} has unknown plan '{}', using {}",
                    TokenMasking.mask(token), account.getPlan(), PlanType.HOBBYIST.id());
            return PlanType.HOBBYIST;
        });

        session = TenantSession.load(account, plan, burstMultiplier, clock.instant());
        if (seed != null) session.resume(seed);
        state = State.LOADED;
        return true;
    }

    private void flushIfDirty() {
        if (!session.isDirty()) return;
        // a rejected snapshot stays dirty and goes out with the next flush
        if (usageWriter.submit(session.snapshot())) {
            session.markClean();
        }
    }
}
