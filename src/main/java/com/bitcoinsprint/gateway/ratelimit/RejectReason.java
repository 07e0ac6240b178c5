package com.bitcoinsprint.gateway.ratelimit;

public enum RejectReason {
    BURST("Burst limit exceeded"),
    MINUTE("Per-minute rate limit exceeded"),
    HOUR("Hourly rate limit exceeded"),
    CONCURRENCY("Too many concurrent requests");

    private final String message;

    RejectReason(String message) { this.message = message; }

    public String message() { return message; }
}
