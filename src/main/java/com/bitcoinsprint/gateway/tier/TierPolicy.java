package com.bitcoinsprint.gateway.tier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable tier-to-limits table, resolved once at startup.
 */
public final class TierPolicy {

    private final Map<Tier, RateLimitPolicy> policies;

    public TierPolicy(Function<Tier, RateLimitPolicy> resolver) {
        EnumMap<Tier, RateLimitPolicy> m = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) {
            m.put(t, Objects.requireNonNull(resolver.apply(t), "no policy for tier " + t));
        }
        this.policies = Collections.unmodifiableMap(m);
    }

    public static TierPolicy defaults() {
        return new TierPolicy(Tier::defaultPolicy);
    }

    public RateLimitPolicy limitsFor(Tier tier) {
        return policies.get(Objects.requireNonNull(tier, "tier"));
    }

    public Map<Tier, RateLimitPolicy> all() {
        return policies;
    }
}
