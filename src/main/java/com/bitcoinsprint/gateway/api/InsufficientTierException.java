package com.bitcoinsprint.gateway.api;

import com.bitcoinsprint.gateway.tier.Tier;
import lombok.Getter;

/**
 * Valid credential, but the endpoint needs a higher tier.
 */
@Getter
public class InsufficientTierException extends RuntimeException {

    private final Tier required;
    private final Tier actual;

    public InsufficientTierException(Tier required, Tier actual) {
        super(capitalize(required.wireName()) + " tier required");
        this.required = required;
        this.actual = actual;
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
