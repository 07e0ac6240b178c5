package com.bitcoinsprint.gateway.auth;

import com.bitcoinsprint.gateway.tier.Tier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key table: API key to owning tier.
 *
 * <p>Lookups are lock-free. Issuance and revocation are administrative and rare;
 * {@link #issueKey(Tier)} relies on {@code putIfAbsent} so a generated key never
 * replaces an existing one.
 */
@Slf4j
public class ApiKeyRegistry {

    private static final int MAX_ISSUE_ATTEMPTS = 8;

    private final Map<String, Tier> keys = new ConcurrentHashMap<>();
    private final ApiKeyHashService hashService;

    public ApiKeyRegistry(Map<Tier, List<String>> seed, ApiKeyHashService hashService) {
        this.hashService = Objects.requireNonNull(hashService, "hashService");
        seed.forEach((tier, list) -> {
            for (String k : list) {
                if (k == null || k.isBlank()) continue;
                Tier previous = keys.putIfAbsent(k.trim(), tier);
                if (previous != null && previous != tier) {
                    throw new IllegalStateException("API key configured for both " + previous + " and " + tier);
                }
            }
        });
    }

    public Optional<Tier> resolveTier(String apiKey) {
        if (apiKey == null) return Optional.empty();
        return Optional.ofNullable(keys.get(apiKey));
    }

    public String issueKey(Tier tier) {
        Objects.requireNonNull(tier, "tier");
        for (int attempt = 0; attempt < MAX_ISSUE_ATTEMPTS; attempt++) {
            String candidate = hashService.generateRawApiKey(tier);
            if (keys.putIfAbsent(candidate, tier) == null) {
                log.info("Issued {} API key fingerprint={}", tier.wireName(), shortFingerprint(candidate));
                return candidate;
            }
        }
        throw new IllegalStateException("Unable to generate a unique API key after " + MAX_ISSUE_ATTEMPTS + " attempts");
    }

    /** Removes a key. Returns whether it was present. */
    public boolean revoke(String apiKey) {
        if (apiKey == null) return false;
        Tier removed = keys.remove(apiKey);
        if (removed != null) {
            log.info("Revoked {} API key fingerprint={}", removed.wireName(), shortFingerprint(apiKey));
        }
        return removed != null;
    }

    public Map<Tier, List<String>> keysByTier() {
        EnumMap<Tier, List<String>> out = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) out.put(t, new ArrayList<>());
        keys.forEach((k, t) -> out.get(t).add(k));
        out.values().forEach(Collections::sort);
        return out;
    }

    public int size() {
        return keys.size();
    }

    String shortFingerprint(String apiKey) {
        return hashService.fingerprint(apiKey).substring(0, 12);
    }
}
