package com.bitcoinsprint.gateway.auth;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class CallerIdentityResolverTest {

    private final ApiKeyHashService hashService = new ApiKeyHashService();
    private final CallerIdentityResolver resolver = new CallerIdentityResolver(hashService);

    @Test
    void forApiKey_shouldUseFingerprintNotRawKey() {
        String identity = resolver.forApiKey("demo-key-free");

        assertThat(identity).isEqualTo("apiKey:" + hashService.fingerprint("demo-key-free"));
        assertThat(identity).doesNotContain("demo-key-free").hasSize("apiKey:".length() + 64);
    }

    @Test
    void forAddress_shouldPreferFirstForwardedFor() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.1");
        req.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.2");
        req.addHeader("X-Real-IP", "198.51.100.1");

        assertThat(resolver.forAddress(req)).isEqualTo("ip:203.0.113.7");
    }

    @Test
    void forAddress_shouldFallBackToRealIpThenSocket() {
        MockHttpServletRequest withRealIp = new MockHttpServletRequest();
        withRealIp.setRemoteAddr("10.0.0.1");
        withRealIp.addHeader("X-Real-IP", "198.51.100.1");

        MockHttpServletRequest plain = new MockHttpServletRequest();
        plain.setRemoteAddr("10.0.0.1");

        assertThat(resolver.forAddress(withRealIp)).isEqualTo("ip:198.51.100.1");
        assertThat(resolver.forAddress(plain)).isEqualTo("ip:10.0.0.1");
    }
}
