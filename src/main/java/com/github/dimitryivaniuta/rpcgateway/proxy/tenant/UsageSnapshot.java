package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import java.time.Instant;

/** Absolute usage values captured under the tenant lock and written behind. */
public record UsageSnapshot(String token, long currentMonthRequests, Instant monthResetAt) {}
