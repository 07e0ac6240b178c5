package com.bitcoinsprint.gateway.api.dto;

/**
 * @param tier requested tier name; {@code free} when omitted
 */
public record GenerateKeyRequest(String tier) {}
