package com.bitcoinsprint.gateway.api.dto;

public record StatusResponse(boolean success, SystemStatus data, String tier) {}
