package com.bitcoinsprint.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * @param apiKeys registered keys grouped by tier name
 */
public record ApiKeysResponse(
        @JsonProperty("api_keys") Map<String, List<String>> apiKeys,
        int total,
        String note
) {}
