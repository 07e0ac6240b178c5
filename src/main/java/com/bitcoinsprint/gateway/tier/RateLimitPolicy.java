package com.bitcoinsprint.gateway.tier;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Quantitative limits owned by a tier. All values are non-negative.
 *
 * @param requestsPerMinute     primary throttle, fixed one-minute window
 * @param requestsPerHour       secondary throttle, fixed one-hour window
 * @param maxConcurrentRequests simultaneously in-flight requests per caller
 * @param burstLimit            token bucket size when larger than {@code requestsPerMinute}
 */
public record RateLimitPolicy(
        @JsonProperty("requests_per_minute") int requestsPerMinute,
        @JsonProperty("requests_per_hour") int requestsPerHour,
        @JsonProperty("concurrent_requests") int maxConcurrentRequests,
        @JsonProperty("burst_limit") int burstLimit
) {
    public RateLimitPolicy {
        if (requestsPerMinute < 0 || requestsPerHour < 0 || maxConcurrentRequests < 0 || burstLimit < 0) {
            throw new IllegalArgumentException("rate limit values must be non-negative");
        }
    }
}
