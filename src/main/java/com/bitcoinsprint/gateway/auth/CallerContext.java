package com.bitcoinsprint.gateway.auth;

import com.bitcoinsprint.gateway.tier.Tier;

/**
 * Resolved caller of one request, stored as a request attribute by the authentication filter.
 *
 * @param identity      rate-limit quota key, {@code apiKey:<sha256>} or {@code ip:<address>}
 * @param tier          tier whose policy applies; anonymous callers are limited as FREE
 * @param authenticated false for anonymous endpoints
 */
public record CallerContext(String identity, Tier tier, boolean authenticated) {

    public static final String ATTRIBUTE = "com.bitcoinsprint.gateway.auth.CallerContext";
    public static final String ANONYMOUS_TIER_LABEL = "anonymous";

    public static CallerContext authenticated(String identity, Tier tier) {
        return new CallerContext(identity, tier, true);
    }

    public static CallerContext anonymous(String identity) {
        return new CallerContext(identity, Tier.FREE, false);
    }

    /** Value of the {@code tier} metrics label. */
    public String tierLabel() {
        return authenticated ? tier.wireName() : ANONYMOUS_TIER_LABEL;
    }
}
