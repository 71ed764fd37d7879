package com.github.dimitryivaniuta.rpcgateway.proxy.plan;

import java.util.Locale;
import java.util.Optional;

/**
 * Compiled-in plan table. A {@code null} monthly limit and an infinite rate both mean "unbounded".
 */
public enum PlanType {

    HOBBYIST("hobbyist", 100_000L, 10),
    SCALING("scaling", 50_000_000L, 100),
    BUSINESS("business", 250_000_000L, 500),
    ENTERPRISE("enterprise", null, Double.POSITIVE_INFINITY);

    private final String id;
    private final Long monthlyLimit;
    private final double requestsPerSecond;

    PlanType(String id, Long monthlyLimit, double requestsPerSecond) {
        this.id = id;
        this.monthlyLimit = monthlyLimit;
        this.requestsPerSecond = requestsPerSecond;
    }

    public String id() { return id; }

    public Long monthlyLimit() { return monthlyLimit; }

    public double requestsPerSecond() { return requestsPerSecond; }

    public boolean hasMonthlyLimit() {
        return monthlyLimit != null;
    }

    /** Requests left this month; {@link Long#MAX_VALUE} for unbounded plans. */
    public long remaining(long used) {
        if (monthlyLimit == null) return Long.MAX_VALUE;
        return Math.max(0L, monthlyLimit - used);
    }

    public static Optional<PlanType> fromId(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (PlanType p : values()) {
            if (p.id.equals(normalized)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
