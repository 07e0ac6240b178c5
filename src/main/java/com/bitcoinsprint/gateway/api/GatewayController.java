package com.bitcoinsprint.gateway.api;

import com.bitcoinsprint.gateway.api.dto.ApiKeysResponse;
import com.bitcoinsprint.gateway.api.dto.GenerateKeyRequest;
import com.bitcoinsprint.gateway.api.dto.GenerateKeyResponse;
import com.bitcoinsprint.gateway.api.dto.HealthResponse;
import com.bitcoinsprint.gateway.api.dto.RevokeKeyResponse;
import com.bitcoinsprint.gateway.api.dto.TierInfoResponse;
import com.bitcoinsprint.gateway.auth.ApiKeyRegistry;
import com.bitcoinsprint.gateway.auth.CallerContext;
import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import com.bitcoinsprint.gateway.ratelimit.TierRateLimiter;
import com.bitcoinsprint.gateway.tier.RateLimitPolicy;
import com.bitcoinsprint.gateway.tier.Tier;
import com.bitcoinsprint.gateway.tier.TierPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoints served by the gateway itself.
 */
@RestController
@RequiredArgsConstructor
public class GatewayController {

    static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");
    private static final String KEY_USAGE_NOTE = "Use Authorization: Bearer <key> header for requests";

    private final ApiKeyRegistry registry;
    private final TierPolicy tierPolicy;
    private final TierRateLimiter rateLimiter;
    private final GatewayMetrics metrics;
    private final Clock clock;

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.healthy(Instant.now(clock));
    }

    /** Demo key issuance. Anonymous; the caller is limited by source address. */
    @PostMapping("/generate-key")
    public GenerateKeyResponse generateKey(@RequestBody(required = false) GenerateKeyRequest body) {
        Tier tier = Tier.FREE;
        if (body != null && body.tier() != null) {
            tier = Tier.parse(body.tier()).orElseThrow(() -> new UnknownTierException(body.tier()));
        }
        String key = registry.issueKey(tier);
        return new GenerateKeyResponse(true, key, tier, tierPolicy.limitsFor(tier),
                "This is a demo key. " + KEY_USAGE_NOTE);
    }

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        requireTier(caller, Tier.ENTERPRISE);
        return ResponseEntity.ok().contentType(PROMETHEUS_TEXT).body(metrics.dump());
    }

    @GetMapping("/api-keys")
    public ApiKeysResponse apiKeys(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        requireTier(caller, Tier.ENTERPRISE);
        Map<String, List<String>> byTier = new LinkedHashMap<>();
        registry.keysByTier().forEach((t, keys) -> byTier.put(t.wireName(), keys));
        return new ApiKeysResponse(byTier, registry.size(), KEY_USAGE_NOTE);
    }

    @DeleteMapping("/api-keys/{key}")
    public RevokeKeyResponse revoke(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                                    @PathVariable String key) {
        requireTier(caller, Tier.ENTERPRISE);
        if (!registry.revoke(key)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown API key");
        }
        return new RevokeKeyResponse(true, true);
    }

    @GetMapping("/tier-info")
    public TierInfoResponse tierInfo(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        RateLimitPolicy limits = tierPolicy.limitsFor(caller.tier());
        TierInfoResponse.Usage usage = rateLimiter.snapshot(caller.identity(), clock.instant())
                .map(s -> new TierInfoResponse.Usage(s.minuteRemaining(), s.hourRemaining(), s.inFlight()))
                .orElseGet(() -> new TierInfoResponse.Usage(limits.requestsPerMinute(), limits.requestsPerHour(), 0));
        return new TierInfoResponse(caller.tier(), limits, usage);
    }

    static void requireTier(CallerContext caller, Tier required) {
        if (!caller.tier().atLeast(required)) {
            throw new InsufficientTierException(required, caller.tier());
        }
    }
}
