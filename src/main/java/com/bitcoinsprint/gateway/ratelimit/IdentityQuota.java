package com.bitcoinsprint.gateway.ratelimit;

import com.bitcoinsprint.gateway.tier.RateLimitPolicy;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Counter state of one caller identity.
 *
 * <p>Two fixed windows, each anchored at the first request it admits: one minute (the primary
 * throttle) and one hour. A token bucket holding {@code max(burst_limit, requests_per_minute)}
 * tokens and refilled at the steady per-minute rate paces traffic across window boundaries, so a
 * full minute window cannot be followed by a second full one a moment later unless the burst
 * allowance covers it. Concurrency is bounded separately by a Resilience4j semaphore bulkhead
 * with zero wait.
 *
 * <p>Window state is guarded by {@code this}; the owning cache additionally serializes
 * admit, release and expiry evaluation per key.
 */
final class IdentityQuota {

    private static final Duration CONCURRENCY_RETRY_AFTER = Duration.ofSeconds(1);

    private final RateLimitPolicy policy;
    private final Bulkhead bulkhead;

    private final TokenBucket bucket;
    private final Window minute = new Window(Duration.ofMinutes(1).toMillis());
    private final Window hour = new Window(Duration.ofHours(1).toMillis());

    IdentityQuota(String identity, RateLimitPolicy policy) {
        this.policy = policy;
        this.bucket = new TokenBucket(Math.max(policy.burstLimit(), policy.requestsPerMinute()), policy.requestsPerMinute());
        this.bulkhead = Bulkhead.of("quota:" + identity, BulkheadConfig.custom()
                .maxConcurrentCalls(policy.maxConcurrentRequests())
                .maxWaitDuration(Duration.ZERO)
                .writableStackTraceEnabled(false)
                .build());
    }

    RateLimitPolicy policy() {
        return policy;
    }

    /**
     * Admits one request at {@code now} or explains why not. Rejections consume no quota.
     * On admission the caller owns one bulkhead permit and must hand it back via {@link #release()}.
     */
    synchronized Decision tryAdmit(Instant now) {
        long t = now.toEpochMilli();

        RejectReason reason = null;
        long waitMillis = 0;
        long bucketWait = bucket.millisUntilToken(t);
        if (bucketWait > 0) {
            reason = RejectReason.BURST;
            waitMillis = bucketWait;
        }
        if (minute.used(t) >= policy.requestsPerMinute() && minute.millisUntilReset(t) >= waitMillis) {
            reason = RejectReason.MINUTE;
            waitMillis = Math.max(minute.millisUntilReset(t), 1);
        }
        if (hour.used(t) >= policy.requestsPerHour() && hour.millisUntilReset(t) >= waitMillis) {
            reason = RejectReason.HOUR;
            waitMillis = Math.max(hour.millisUntilReset(t), 1);
        }
        if (reason != null) {
            return Decision.reject(reason, waitMillis);
        }

        if (!bulkhead.tryAcquirePermission()) {
            return Decision.reject(RejectReason.CONCURRENCY, CONCURRENCY_RETRY_AFTER.toMillis());
        }

        bucket.take(t);
        minute.record(t);
        hour.record(t);
        return Decision.admit(Math.max(0, policy.requestsPerMinute() - minute.used(t)));
    }

    void release() {
        bulkhead.onComplete();
    }

    int inFlight() {
        Bulkhead.Metrics m = bulkhead.getMetrics();
        return m.getMaxAllowedConcurrentCalls() - m.getAvailableConcurrentCalls();
    }

    synchronized int minuteRemaining(Instant now) {
        return Math.max(0, policy.requestsPerMinute() - minute.used(now.toEpochMilli()));
    }

    synchronized int hourRemaining(Instant now) {
        return Math.max(0, policy.requestsPerHour() - hour.used(now.toEpochMilli()));
    }

    record Decision(boolean admitted, RejectReason reason, long waitMillis, int minuteRemaining) {
        static Decision admit(int minuteRemaining) {
            return new Decision(true, null, 0, minuteRemaining);
        }

        static Decision reject(RejectReason reason, long waitMillis) {
            return new Decision(false, reason, waitMillis, 0);
        }
    }

    /** Fixed window that starts at the first request recorded after the previous one ended. */
    private static final class Window {
        private static final long NOT_STARTED = Long.MIN_VALUE;

        private final long lengthMillis;
        private long startMillis = NOT_STARTED;
        private int count;

        Window(long lengthMillis) {
            this.lengthMillis = lengthMillis;
        }

        private boolean elapsed(long now) {
            return startMillis == NOT_STARTED || now - startMillis >= lengthMillis;
        }

        int used(long now) {
            return elapsed(now) ? 0 : count;
        }

        long millisUntilReset(long now) {
            return elapsed(now) ? 0 : startMillis + lengthMillis - now;
        }

        void record(long now) {
            if (elapsed(now)) {
                startMillis = now;
                count = 1;
            } else {
                count++;
            }
        }
    }

    /**
     * Token bucket in integer units: one token is {@code 60_000} units and the bucket gains
     * {@code requestsPerMinute} units per elapsed millisecond. Starts full.
     */
    private static final class TokenBucket {
        private static final long UNITS_PER_TOKEN = Duration.ofMinutes(1).toMillis();

        private final long capacityUnits;
        private final long unitsPerMilli;
        private long units;
        private long lastRefillMillis = Long.MIN_VALUE;

        TokenBucket(int capacityTokens, int requestsPerMinute) {
            this.capacityUnits = capacityTokens * UNITS_PER_TOKEN;
            this.unitsPerMilli = requestsPerMinute;
            this.units = capacityUnits;
        }

        private void refill(long now) {
            if (lastRefillMillis == Long.MIN_VALUE) {
                lastRefillMillis = now;
                return;
            }
            long elapsed = now - lastRefillMillis;
            if (elapsed <= 0) return;
            long gained = elapsed >= capacityUnits ? capacityUnits * Long.signum(unitsPerMilli) : elapsed * unitsPerMilli;
            units = Math.min(capacityUnits, units + gained);
            lastRefillMillis = now;
        }

        /** 0 when a token is available at {@code now}; no wait is reported for a zero refill rate. */
        long millisUntilToken(long now) {
            refill(now);
            long deficit = UNITS_PER_TOKEN - units;
            if (deficit <= 0 || unitsPerMilli == 0) return 0;
            return (deficit + unitsPerMilli - 1) / unitsPerMilli;
        }

        void take(long now) {
            refill(now);
            units -= UNITS_PER_TOKEN;
        }
    }
}
