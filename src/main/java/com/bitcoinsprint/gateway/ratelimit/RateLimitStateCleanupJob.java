package com.bitcoinsprint.gateway.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops counter state of identities idle beyond {@code gateway.rate-limit.idle-ttl}.
 * Caffeine only expires entries during cache activity; this keeps memory bounded when traffic stops.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitStateCleanupJob {

    private final TierRateLimiter rateLimiter;

    @Scheduled(fixedDelayString = "${gateway.rate-limit.cleanup-interval:PT1M}")
    public void evictIdleIdentities() {
        long dropped = rateLimiter.evictIdle();
        if (dropped > 0) {
            log.info("Rate-limit cleanup dropped {} idle identities, {} still tracked",
                    dropped, rateLimiter.trackedIdentities());
        }
    }
}
