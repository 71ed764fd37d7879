package com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ClientIpResolverTest {

    private final ClientIpResolver resolver = new ClientIpResolver();

    @Test
    void firstForwardedForEntryWins() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader("X-Forwarded-For", " 203.0.113.9 , 10.0.0.1");
        req.addHeader("X-Real-IP", "198.51.100.2");

        assertThat(resolver.resolve(req)).isEqualTo("203.0.113.9");
    }

    @Test
    void fallsBackToRealIpThenRemoteAddress() {
        MockHttpServletRequest withRealIp = new MockHttpServletRequest();
        withRealIp.addHeader("X-Real-IP", "198.51.100.2");
        assertThat(resolver.resolve(withRealIp)).isEqualTo("198.51.100.2");

        MockHttpServletRequest plain = new MockHttpServletRequest();
        plain.setRemoteAddr("192.0.2.44");
        assertThat(resolver.resolve(plain)).isEqualTo("192.0.2.44");
    }

    @Test
    void missingRequestIsUnknown() {
        assertThat(resolver.resolve(null)).isEqualTo(ClientIpResolver.UNKNOWN);
    }
}
