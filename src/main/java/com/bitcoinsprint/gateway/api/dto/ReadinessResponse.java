package com.bitcoinsprint.gateway.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ReadinessResponse(boolean success, JsonNode data, String tier) {}
