package com.bitcoinsprint.gateway.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Component
@Order(GatewayFilterOrder.CORRELATION)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final int MAX_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {

        String corr = sanitize(request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER));
        if (corr == null) corr = UUID.randomUUID().toString();

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    // caller-supplied ids end up in logs and response headers
    private static String sanitize(String v) {
        if (v == null) return null;
        v = v.trim();
        if (v.isEmpty() || v.length() > MAX_LENGTH) return null;
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            if (c < 0x21 || c > 0x7e) return null;
        }
        return v;
    }
}
