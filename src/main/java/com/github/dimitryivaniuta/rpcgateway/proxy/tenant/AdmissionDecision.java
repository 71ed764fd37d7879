package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

/**
 * Result of one admission check. {@code reason} is null when allowed;
 * {@code remaining} is {@link Long#MAX_VALUE} for plans without a monthly cap.
 */
public record AdmissionDecision(boolean allowed, DenialReason reason, long remaining) {

    public static AdmissionDecision allow(long remaining) {
        return new AdmissionDecision(true, null, remaining);
    }

    public static AdmissionDecision deny(DenialReason reason, long remaining) {
        return new AdmissionDecision(false, reason, remaining);
    }
}
