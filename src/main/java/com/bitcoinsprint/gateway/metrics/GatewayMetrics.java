package com.bitcoinsprint.gateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request-level metrics of the gateway.
 *
 * <p>Owns no global state: every instance writes to the registry it was given, so tests build
 * their own. Micrometer counters and timers are lock-free and safe for concurrent increments;
 * {@link #dump()} may run alongside them.
 */
public class GatewayMetrics {

    public static final String REQUESTS = "api.requests";
    public static final String REQUEST_DURATION = "api.request.duration";
    public static final String ACTIVE_CONNECTIONS = "api.active.connections";
    public static final String RATE_LIMIT_HITS = "api.rate.limit.hits";
    public static final String AUTH_FAILURES = "api.auth.failures";
    public static final String BACKEND_DURATION = "api.backend.request.duration";

    /** Endpoint label for requests that never reached a route. */
    public static final String UNMATCHED_ENDPOINT = "unmatched";

    // fixed buckets 5ms..10s
    private static final Duration[] LATENCY_BUCKETS = {
            Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(25), Duration.ofMillis(50),
            Duration.ofMillis(75), Duration.ofMillis(100), Duration.ofMillis(250), Duration.ofMillis(500),
            Duration.ofMillis(750), Duration.ofSeconds(1), Duration.ofMillis(2500), Duration.ofSeconds(5),
            Duration.ofMillis(7500), Duration.ofSeconds(10)
    };

    private final PrometheusMeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public GatewayMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(ACTIVE_CONNECTIONS, activeConnections, AtomicInteger::get)
                .description("Number of active connections")
                .register(registry);
    }

    // ---- Requests ----
    public void recordRequest(String method, String endpoint, String tier, int status, Duration duration) {
        Counter.builder(REQUESTS)
                .description("Total number of API requests")
                .tag("method", method)
                .tag("endpoint", endpoint)
                .tag("tier", tier)
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();

        Timer.builder(REQUEST_DURATION)
                .description("Request duration in seconds")
                .tag("method", method)
                .tag("endpoint", endpoint)
                .tag("tier", tier)
                .serviceLevelObjectives(LATENCY_BUCKETS)
                .register(registry)
                .record(duration);
    }

    public double requestCount(String method, String endpoint, String tier, int status) {
        Counter c = registry.find(REQUESTS)
                .tags("method", method, "endpoint", endpoint, "tier", tier, "status", String.valueOf(status))
                .counter();
        return c == null ? 0 : c.count();
    }

    // ---- Connections ----
    public int connectionOpened() {
        return activeConnections.incrementAndGet();
    }

    public int connectionClosed() {
        return activeConnections.decrementAndGet();
    }

    public void setActiveConnections(int n) {
        activeConnections.set(n);
    }

    public int activeConnections() {
        return activeConnections.get();
    }

    // ---- Rate limiting / auth ----
    public void rateLimitHit(String tier) {
        Counter.builder(RATE_LIMIT_HITS)
                .description("Total number of rate limit hits")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void authFailure(String reason) {
        Counter.builder(AUTH_FAILURES)
                .description("Requests rejected for a missing, malformed or unknown API key")
                .tag("reason", reason) // missing | malformed | unknown
                .register(registry)
                .increment();
    }

    // ---- Backend ----
    public void recordBackendCall(String outcome, long nanos) {
        Timer.builder(BACKEND_DURATION)
                .description("Backend call duration in seconds")
                .tag("outcome", outcome) // ok | timeout | error
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    /** Prometheus text exposition of every series. */
    public String dump() {
        return registry.scrape();
    }
}
