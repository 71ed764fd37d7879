package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import java.time.Instant;

/**
 * Bucket and quota state a retired actor passes to its successor, so a reload neither refills the
 * bucket nor falls behind a snapshot that is still queued for the database.
 */
record TenantHandoff(double tokens, Instant lastRefill, long currentMonthRequests, Instant monthResetAt) {
}
