package com.bitcoinsprint.gateway.tier;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Service class of a caller. Declaration order is privilege order: FREE &lt; PRO &lt; ENTERPRISE.
 */
public enum Tier {
    FREE,
    PRO,
    ENTERPRISE;

    /** Lower-case name used on the wire, in metrics labels and in issued keys. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean atLeast(Tier required) {
        return compareTo(required) >= 0;
    }

    /**
     * Built-in limits per tier. Exhaustive switch: adding a tier without limits does not compile.
     */
    public RateLimitPolicy defaultPolicy() {
        return switch (this) {
            case FREE -> new RateLimitPolicy(20, 100, 2, 5);
            case PRO -> new RateLimitPolicy(1_000, 10_000, 10, 50);
            case ENTERPRISE -> new RateLimitPolicy(10_000, 100_000, 100, 500);
        };
    }

    public static Optional<Tier> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (Tier t : values()) {
            if (t.name().equals(v)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
