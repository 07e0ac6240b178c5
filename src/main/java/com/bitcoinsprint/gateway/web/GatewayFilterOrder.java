package com.bitcoinsprint.gateway.web;

import org.springframework.core.Ordered;

/**
 * Order of the request pipeline. Each stage either short-circuits with a complete response
 * or passes the request on, possibly annotated with request attributes.
 *
 * <ol>
 *   <li>{@link #CORRELATION}: assigns {@code X-Correlation-Id}, puts it in the MDC.</li>
 *   <li>{@link #METRICS}: wraps everything below; records exactly one sample per request.</li>
 *   <li>{@link #CORS}: answers preflight requests, adds CORS response headers.</li>
 *   <li>{@link #AUTHENTICATION}: resolves the bearer key to a tier and stores a
 *       {@code CallerContext}; 401 on a missing, malformed or unknown key.</li>
 *   <li>{@link #RATE_LIMIT}: admits against the caller's tier policy; 429 with
 *       {@code Retry-After} on reject. Releases the concurrency slot after the rest of the chain.</li>
 * </ol>
 * Controllers run after the last stage and enforce per-endpoint tier requirements (403).
 */
public final class GatewayFilterOrder {
    private GatewayFilterOrder() {}

    public static final int CORRELATION = Ordered.HIGHEST_PRECEDENCE + 10;
    public static final int METRICS = Ordered.HIGHEST_PRECEDENCE + 20;
    public static final int CORS = Ordered.HIGHEST_PRECEDENCE + 25;
    public static final int AUTHENTICATION = Ordered.HIGHEST_PRECEDENCE + 30;
    public static final int RATE_LIMIT = Ordered.HIGHEST_PRECEDENCE + 40;
}
