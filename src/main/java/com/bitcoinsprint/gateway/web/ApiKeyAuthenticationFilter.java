package com.bitcoinsprint.gateway.web;

import com.bitcoinsprint.gateway.auth.ApiKeyRegistry;
import com.bitcoinsprint.gateway.auth.BearerTokenExtractor;
import com.bitcoinsprint.gateway.auth.CallerContext;
import com.bitcoinsprint.gateway.auth.CallerIdentityResolver;
import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import com.bitcoinsprint.gateway.tier.Tier;
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
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves {@code Authorization: Bearer <api-key>} to a tier.
 *
 * <p>Health reads pass through without a caller. Key generation ({@code POST}) is served
 * anonymously and limited by source address. Everything else requires a registered key.
 */
@Slf4j
@Component
@Order(GatewayFilterOrder.AUTHENTICATION)
@RequiredArgsConstructor
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    static final Set<String> PUBLIC_PATHS = Set.of("/health", "/actuator/health");
    static final String ANONYMOUS_PATH = "/generate-key";

    private final ApiKeyRegistry registry;
    private final CallerIdentityResolver identityResolver;
    private final GatewayMetrics metrics;
    private final ApiErrorResponder errorResponder;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);

        boolean read = "GET".equals(request.getMethod()) || "HEAD".equals(request.getMethod());
        if (read && isPublic(path)) {
            chain.doFilter(request, response);
            return;
        }
        if ("POST".equals(request.getMethod()) && ANONYMOUS_PATH.equals(path)) {
            request.setAttribute(CallerContext.ATTRIBUTE, CallerContext.anonymous(identityResolver.forAddress(request)));
            chain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            reject(request, response, "missing", "Missing API key. Use Authorization: Bearer <key>");
            return;
        }
        Optional<String> key = BearerTokenExtractor.extract(header);
        if (key.isEmpty()) {
            reject(request, response, "malformed", "Malformed Authorization header. Use Authorization: Bearer <key>");
            return;
        }
        Optional<Tier> tier = registry.resolveTier(key.get());
        if (tier.isEmpty()) {
            reject(request, response, "unknown", "Invalid API key");
            return;
        }

        request.setAttribute(CallerContext.ATTRIBUTE,
                CallerContext.authenticated(identityResolver.forApiKey(key.get()), tier.get()));
        chain.doFilter(request, response);
    }

    private static boolean isPublic(String path) {
        return PUBLIC_PATHS.contains(path) || path.startsWith("/actuator/health/");
    }

    private void reject(HttpServletRequest request, HttpServletResponse response,
                        String reason, String message) throws IOException {
        metrics.authFailure(reason);
        log.warn("Authentication failed reason={} method={} path={}", reason, request.getMethod(), request.getRequestURI());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        errorResponder.write(request, response, HttpStatus.UNAUTHORIZED, message);
    }
}
