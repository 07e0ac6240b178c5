package com.bitcoinsprint.gateway.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void shouldEchoCallerSuppliedIdAndExposeItInMdc() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/status");
        req.addHeader("X-Correlation-Id", "req-42");
        MockHttpServletResponse res = new MockHttpServletResponse();
        AtomicReference<String> inMdc = new AtomicReference<>();

        filter.doFilter(req, res, (rq, rs) -> inMdc.set(MDC.get("correlationId")));

        assertThat(res.getHeader("X-Correlation-Id")).isEqualTo("req-42");
        assertThat(inMdc.get()).isEqualTo("req-42");
        assertThat(MDC.get("correlationId")).isNull();
    }

    @Test
    void shouldGenerateIdWhenMissingOrUnusable() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/status");
        req.addHeader("X-Correlation-Id", "has spaces\r\ninjected");
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, (rq, rs) -> { });

        assertThat(res.getHeader("X-Correlation-Id"))
                .isNotBlank()
                .matches("[0-9a-f\\-]{36}");
    }
}
