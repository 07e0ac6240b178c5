package com.bitcoinsprint.gateway.web;

import com.bitcoinsprint.gateway.auth.CallerContext;
import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.time.Duration;

/**
 * Records one metrics sample per request, whatever the outcome: short-circuits by later
 * filters, handler errors and client disconnects included.
 *
 * <p>A caller that disconnected before the response was written is recorded with status 499.
 *
 * <p>The {@code endpoint} label is the matched route pattern for local endpoints and the raw
 * path for authenticated calls to the catch-all proxy. Anything else, such as a 401 or a CORS
 * preflight, shares the {@value GatewayMetrics#UNMATCHED_ENDPOINT} label so that unauthenticated
 * callers cannot mint new series.
 */
@Slf4j
@Component
@Order(GatewayFilterOrder.METRICS)
@RequiredArgsConstructor
public class RequestMetricsFilter extends OncePerRequestFilter {

    private static final String CATCH_ALL_PATTERN = "/**";

    private final GatewayMetrics metrics;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        long start = System.nanoTime();
        metrics.connectionOpened();
        Integer forcedStatus = null;
        try {
            chain.doFilter(request, response);
        } catch (IOException ex) {
            forcedStatus = RequestContextKeys.CLIENT_CLOSED_REQUEST;
            log.info("Client closed request {} {}: {}", request.getMethod(), request.getRequestURI(), ex.toString());
        } catch (ServletException | RuntimeException ex) {
            forcedStatus = 500;
            throw ex;
        } finally {
            metrics.connectionClosed();
            int status = forcedStatus != null ? forcedStatus : statusOf(request, response);
            metrics.recordRequest(
                    request.getMethod(),
                    endpointLabel(request),
                    tierLabel(request),
                    status,
                    Duration.ofNanos(System.nanoTime() - start)
            );
        }
    }

    private static int statusOf(HttpServletRequest request, HttpServletResponse response) {
        if (Boolean.TRUE.equals(request.getAttribute(RequestContextKeys.CLIENT_CANCELLED_ATTRIBUTE))) {
            return RequestContextKeys.CLIENT_CLOSED_REQUEST;
        }
        return response.getStatus();
    }

    static String endpointLabel(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern instanceof String p && !CATCH_ALL_PATTERN.equals(p)) {
            return p;
        }
        Object caller = request.getAttribute(CallerContext.ATTRIBUTE);
        if (caller instanceof CallerContext ctx && ctx.authenticated()) {
            return request.getRequestURI();
        }
        return GatewayMetrics.UNMATCHED_ENDPOINT;
    }

    private static String tierLabel(HttpServletRequest request) {
        Object caller = request.getAttribute(CallerContext.ATTRIBUTE);
        return caller instanceof CallerContext ctx ? ctx.tierLabel() : CallerContext.ANONYMOUS_TIER_LABEL;
    }
}
