package com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller address used as the public rate-limit key. The address is used for
 * limiting only; it is never logged or attached to request events.
 */
@Component
public final class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    public String resolve(HttpServletRequest req) {
        if (req == null) return UNKNOWN;

        // X-Forwarded-For may contain "client, proxy1, proxy2"
        String xff = header(req, "X-Forwarded-For");
        if (xff != null) {
            int comma = xff.indexOf(',');
            String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
            if (!first.isBlank()) return first;
        }
        String realIp = header(req, "X-Real-IP");
        if (realIp != null) return realIp;

        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? UNKNOWN : ra;
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
