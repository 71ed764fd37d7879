package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;

@Service
public class TenantTokenService {

    private final SecureRandom secureRandom = new SecureRandom();

    /** 256-bit random bearer token, base64url without padding (43 chars). */
    public String generateToken() {
        byte[] buf = new byte[32];
        secureRandom.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }
}
