package com.bitcoinsprint.gateway.ratelimit;

import com.bitcoinsprint.gateway.tier.RateLimitPolicy;
import com.bitcoinsprint.gateway.tier.Tier;
import com.bitcoinsprint.gateway.tier.TierPolicy;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-identity admission control against the caller's tier policy.
 *
 * <p>State is kept in a Caffeine cache keyed by identity. Every mutation goes through
 * {@code asMap().compute*}, which serializes admit, release and expiry evaluation for one key
 * without blocking other identities. An entry holding in-flight permits never expires; once
 * its last permit is released it becomes evictable after {@code idleTtl}.
 */
@Slf4j
public class TierRateLimiter {

    private final TierPolicy tierPolicy;
    private final Cache<String, IdentityQuota> quotas;
    private final AtomicLong evicted = new AtomicLong();

    public TierRateLimiter(TierPolicy tierPolicy, Duration idleTtl) {
        this(tierPolicy, idleTtl, Ticker.systemTicker());
    }

    public TierRateLimiter(TierPolicy tierPolicy, Duration idleTtl, Ticker ticker) {
        this.tierPolicy = Objects.requireNonNull(tierPolicy, "tierPolicy");
        long ttlNanos = idleTtl.toNanos();
        this.quotas = Caffeine.newBuilder()
                .ticker(ticker)
                // maintenance (expiry, listener) on the calling thread, never a pool
                .executor(Runnable::run)
                .expireAfter(new IdleExpiry(ttlNanos))
                .evictionListener((String identity, IdentityQuota q, RemovalCause cause) -> {
                    if (cause.wasEvicted()) evicted.incrementAndGet();
                })
                .build();
    }

    public Admission admit(String identity, Tier tier, Instant now) {
        Objects.requireNonNull(identity, "identity");
        RateLimitPolicy policy = tierPolicy.limitsFor(tier);

        IdentityQuota[] holder = new IdentityQuota[1];
        IdentityQuota.Decision[] decision = new IdentityQuota.Decision[1];
        quotas.asMap().compute(identity, (k, existing) -> {
            IdentityQuota q = existing;
            if (q == null || (!q.policy().equals(policy) && q.inFlight() == 0)) {
                q = new IdentityQuota(k, policy);
            }
            holder[0] = q;
            decision[0] = q.tryAdmit(now);
            return q;
        });

        IdentityQuota.Decision d = decision[0];
        if (!d.admitted()) {
            return new Admission.Rejected(d.reason(), toRetryAfterSeconds(d.waitMillis()));
        }
        IdentityQuota quota = holder[0];
        Permit permit = new Permit(() -> release(identity, quota));
        return new Admission.Admitted(permit, policy.requestsPerMinute(), d.minuteRemaining());
    }

    private void release(String identity, IdentityQuota quota) {
        // computeIfPresent re-evaluates expiry now that the slot is free
        IdentityQuota present = quotas.asMap().computeIfPresent(identity, (k, current) -> {
            quota.release();
            return current;
        });
        if (present == null) {
            quota.release();
        }
    }

    /** Current counters of an identity, empty when it has no tracked state. */
    public Optional<QuotaSnapshot> snapshot(String identity, Instant now) {
        IdentityQuota q = quotas.getIfPresent(identity);
        if (q == null) return Optional.empty();
        return Optional.of(new QuotaSnapshot(q.policy(), q.minuteRemaining(now), q.hourRemaining(now), q.inFlight()));
    }

    public int inFlight(String identity) {
        IdentityQuota q = quotas.getIfPresent(identity);
        return q == null ? 0 : q.inFlight();
    }

    /** Runs pending expiry; returns how many idle identities were dropped by this call. */
    public long evictIdle() {
        long before = evicted.get();
        quotas.cleanUp();
        return evicted.get() - before;
    }

    public long trackedIdentities() {
        return quotas.estimatedSize();
    }

    static long toRetryAfterSeconds(long waitMillis) {
        return Math.max(1L, (waitMillis + 999) / 1000);
    }

    public record QuotaSnapshot(RateLimitPolicy policy, int minuteRemaining, int hourRemaining, int inFlight) {}

    private static final class IdleExpiry implements Expiry<String, IdentityQuota> {
        private final long ttlNanos;

        IdleExpiry(long ttlNanos) {
            this.ttlNanos = ttlNanos;
        }

        private long ttl(IdentityQuota q) {
            return q.inFlight() > 0 ? Long.MAX_VALUE : ttlNanos;
        }

        @Override
        public long expireAfterCreate(String key, IdentityQuota value, long currentTime) {
            return ttl(value);
        }

        @Override
        public long expireAfterUpdate(String key, IdentityQuota value, long currentTime, long currentDuration) {
            return ttl(value);
        }

        @Override
        public long expireAfterRead(String key, IdentityQuota value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
