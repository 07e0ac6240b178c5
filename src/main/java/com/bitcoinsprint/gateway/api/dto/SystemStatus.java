package com.bitcoinsprint.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Backend status enriched with gateway fields. {@code chains}, {@code sla_assessment} and
 * {@code system_health} are the backend's documents, untouched.
 */
public record SystemStatus(
        @JsonProperty("server_status") String serverStatus,
        @JsonProperty("gateway_version") String gatewayVersion,
        @JsonProperty("backend_status") String backendStatus,
        String uptime,
        JsonNode chains,
        @JsonProperty("sla_assessment") JsonNode slaAssessment,
        @JsonProperty("system_health") JsonNode systemHealth,
        Instant timestamp
) {}
