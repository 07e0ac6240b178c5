package com.bitcoinsprint.gateway.api.dto;

public record RevokeKeyResponse(boolean success, boolean revoked) {}
