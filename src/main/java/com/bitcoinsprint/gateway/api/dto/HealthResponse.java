package com.bitcoinsprint.gateway.api.dto;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {

    public static HealthResponse healthy(Instant now) {
        return new HealthResponse("healthy", now);
    }
}
