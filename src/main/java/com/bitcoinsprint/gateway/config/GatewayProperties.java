package com.bitcoinsprint.gateway.config;

import com.bitcoinsprint.gateway.tier.RateLimitPolicy;
import com.bitcoinsprint.gateway.tier.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Startup configuration of the gateway, bound once from {@code gateway.*}.
 * A missing backend URL fails startup; nothing here is reloaded at runtime.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private String version = "2.5.0";

    @Valid
    @NotNull
    private Backend backend = new Backend();

    /** Optional per-tier overrides of the built-in limits. */
    private Map<Tier, @Valid TierLimits> tiers = new EnumMap<>(Tier.class);

    /** Keys provisioned at startup, grouped by owning tier. */
    private Map<Tier, List<String>> apiKeys = new EnumMap<>(Tier.class);

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    @NotNull
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Backend {
        @NotBlank
        @URL
        private String baseUrl;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class TierLimits {
        @Min(0) private Integer requestsPerMinute;
        @Min(0) private Integer requestsPerHour;
        @Min(0) private Integer concurrentRequests;
        @Min(0) private Integer burstLimit;

        RateLimitPolicy applyTo(RateLimitPolicy base) {
            return new RateLimitPolicy(
                    requestsPerMinute != null ? requestsPerMinute : base.requestsPerMinute(),
                    requestsPerHour != null ? requestsPerHour : base.requestsPerHour(),
                    concurrentRequests != null ? concurrentRequests : base.maxConcurrentRequests(),
                    burstLimit != null ? burstLimit : base.burstLimit()
            );
        }
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Idle time after which an identity's counters are dropped. Keep above one hour. */
        @NotNull
        private Duration idleTtl = Duration.ofHours(2);

        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = List.of("*");
    }

    /** Effective policy for a tier: built-in limits with any configured override applied. */
    public RateLimitPolicy policyFor(Tier tier) {
        TierLimits override = tiers.get(tier);
        RateLimitPolicy base = tier.defaultPolicy();
        return override == null ? base : override.applyTo(base);
    }
}
