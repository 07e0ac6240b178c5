package com.bitcoinsprint.gateway.web;

import com.bitcoinsprint.gateway.auth.CallerContext;
import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import com.bitcoinsprint.gateway.ratelimit.Admission;
import com.bitcoinsprint.gateway.ratelimit.TierRateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

/**
 * The only rate-limit enforcement point. Requests without a caller (health checks) are not limited.
 *
 * <p>An admitted request holds one concurrency slot of its identity until the rest of the chain
 * returns or throws.
 */
@Slf4j
@Component
@Order(GatewayFilterOrder.RATE_LIMIT)
@RequiredArgsConstructor
public class TierRateLimitFilter extends OncePerRequestFilter {

    private final TierRateLimiter rateLimiter;
    private final GatewayMetrics metrics;
    private final ApiErrorResponder errorResponder;
    private final Clock clock;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        Object attr = request.getAttribute(CallerContext.ATTRIBUTE);
        if (!(attr instanceof CallerContext caller)) {
            chain.doFilter(request, response);
            return;
        }

        Admission admission = rateLimiter.admit(caller.identity(), caller.tier(), clock.instant());
        if (admission instanceof Admission.Rejected rejected) {
            metrics.rateLimitHit(caller.tierLabel());
            log.warn("Rate limited tier={} reason={} retryAfter={}s path={}",
                    caller.tierLabel(), rejected.reason(), rejected.retryAfterSeconds(), request.getRequestURI());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(rejected.retryAfterSeconds()));
            errorResponder.write(request, response, HttpStatus.TOO_MANY_REQUESTS, rejected.reason().message());
            return;
        }

        Admission.Admitted admitted = (Admission.Admitted) admission;
        response.setHeader(RequestContextKeys.RATE_LIMIT_LIMIT_HEADER, String.valueOf(admitted.minuteLimit()));
        response.setHeader(RequestContextKeys.RATE_LIMIT_REMAINING_HEADER, String.valueOf(admitted.minuteRemaining()));
        try {
            chain.doFilter(request, response);
        } finally {
            admitted.permit().release();
        }
    }
}
