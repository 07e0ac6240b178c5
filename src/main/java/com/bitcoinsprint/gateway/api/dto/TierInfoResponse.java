package com.bitcoinsprint.gateway.api.dto;

import com.bitcoinsprint.gateway.tier.RateLimitPolicy;
import com.bitcoinsprint.gateway.tier.Tier;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TierInfoResponse(Tier tier, RateLimitPolicy limits, Usage usage) {

    /**
     * Caller's standing at the time of the call; this request is already counted.
     */
    public record Usage(
            @JsonProperty("minute_remaining") int minuteRemaining,
            @JsonProperty("hour_remaining") int hourRemaining,
            @JsonProperty("in_flight") int inFlight
    ) {}
}
