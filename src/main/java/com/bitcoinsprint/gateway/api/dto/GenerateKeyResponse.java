package com.bitcoinsprint.gateway.api.dto;

import com.bitcoinsprint.gateway.tier.RateLimitPolicy;
import com.bitcoinsprint.gateway.tier.Tier;
import com.fasterxml.jackson.annotation.JsonProperty;

public record GenerateKeyResponse(
        boolean success,
        @JsonProperty("api_key") String apiKey,
        Tier tier,
        RateLimitPolicy limits,
        String note
) {}
