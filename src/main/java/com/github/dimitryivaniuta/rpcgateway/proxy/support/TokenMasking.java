package com.github.dimitryivaniuta.rpcgateway.proxy.support;

/**
 * Bearer tokens never appear in logs or events in full.
 */
public final class TokenMasking {
    private TokenMasking() {}

    private static final int VISIBLE_PREFIX = 6;

    public static String mask(String token) {
        if (token == null || token.isBlank()) return "<none>";
        if (token.length() <= VISIBLE_PREFIX) return "***";
        return token.substring(0, VISIBLE_PREFIX) + "***";
    }
}
