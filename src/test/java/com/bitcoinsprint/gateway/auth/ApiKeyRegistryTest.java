package com.bitcoinsprint.gateway.auth;

import com.bitcoinsprint.gateway.tier.Tier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;


class ApiKeyRegistryTest {

    private final ApiKeyHashService hashService = new ApiKeyHashService();

    private ApiKeyRegistry seeded() {
        Map<Tier, List<String>> seed = new EnumMap<>(Tier.class);
        seed.put(Tier.FREE, List.of("demo-key-free", "bitcoin-sprint-free-2024"));
        seed.put(Tier.PRO, List.of("demo-key-pro"));
        seed.put(Tier.ENTERPRISE, List.of("demo-key-enterprise"));
        return new ApiKeyRegistry(seed, hashService);
    }

    @Test
    void resolveTier_shouldReturnTierOfEveryKnownKey() {
        ApiKeyRegistry registry = seeded();

        assertThat(registry.resolveTier("demo-key-free")).contains(Tier.FREE);
        assertThat(registry.resolveTier("bitcoin-sprint-free-2024")).contains(Tier.FREE);
        assertThat(registry.resolveTier("demo-key-pro")).contains(Tier.PRO);
        assertThat(registry.resolveTier("demo-key-enterprise")).contains(Tier.ENTERPRISE);
    }

    @Test
    void resolveTier_shouldReturnEmptyForUnknownStrings() {
        ApiKeyRegistry registry = seeded();

        assertThat(registry.resolveTier("demo-key-FREE")).isEmpty();
        assertThat(registry.resolveTier("")).isEmpty();
        assertThat(registry.resolveTier(null)).isEmpty();
    }

    @Test
    void issueKey_shouldRegisterKeyUnderRequestedTier() {
        ApiKeyRegistry registry = seeded();

        String key = registry.issueKey(Tier.PRO);

        assertThat(key).matches("bitcoin-sprint-pro-[A-Za-z0-9]{16}");
        assertThat(registry.resolveTier(key)).contains(Tier.PRO);
        assertThat(registry.keysByTier().get(Tier.PRO)).contains(key);
    }

    @Test
    void issueKey_shouldRetryOnCollision() {
        ApiKeyHashService colliding = spy(new ApiKeyHashService());
        doReturn("demo-key-free", "bitcoin-sprint-free-AAAAAAAAAAAAAAAA")
                .when(colliding).generateRawApiKey(any());
        ApiKeyRegistry registry = new ApiKeyRegistry(Map.of(Tier.FREE, List.of("demo-key-free")), colliding);

        assertThat(registry.issueKey(Tier.FREE)).isEqualTo("bitcoin-sprint-free-AAAAAAAAAAAAAAAA");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void issueKey_shouldGiveUpWhenEveryCandidateCollides() {
        ApiKeyHashService colliding = spy(new ApiKeyHashService());
        doReturn("demo-key-free").when(colliding).generateRawApiKey(any());
        ApiKeyRegistry registry = new ApiKeyRegistry(Map.of(Tier.FREE, List.of("demo-key-free")), colliding);

        assertThatThrownBy(() -> registry.issueKey(Tier.PRO)).isInstanceOf(IllegalStateException.class);
        assertThat(registry.resolveTier("demo-key-free")).contains(Tier.FREE);
    }

    @Test
    void issueKey_concurrentIssuance_shouldNeverHandOutTheSameKeyTwice() throws Exception {
        ApiKeyRegistry registry = seeded();
        int before = registry.size();
        Set<String> issued = ConcurrentHashMap.newKeySet();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    for (int j = 0; j < 250; j++) issued.add(registry.issueKey(Tier.FREE));
                }));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(issued).hasSize(2000);
        assertThat(registry.size()).isEqualTo(before + 2000);
    }

    @Test
    void revoke_shouldRemoveKey() {
        ApiKeyRegistry registry = seeded();

        assertThat(registry.revoke("demo-key-pro")).isTrue();
        assertThat(registry.resolveTier("demo-key-pro")).isEmpty();
        assertThat(registry.revoke("demo-key-pro")).isFalse();
    }

    @Test
    void seed_withSameKeyInTwoTiers_shouldFail() {
        Map<Tier, List<String>> seed = new EnumMap<>(Tier.class);
        seed.put(Tier.FREE, List.of("shared"));
        seed.put(Tier.PRO, List.of("shared"));

        assertThatThrownBy(() -> new ApiKeyRegistry(seed, hashService))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void keysByTier_shouldListEveryTierSorted() {
        Map<Tier, List<String>> byTier = seeded().keysByTier();

        assertThat(byTier).containsOnlyKeys(Tier.values());
        assertThat(byTier.get(Tier.FREE)).containsExactly("bitcoin-sprint-free-2024", "demo-key-free");
        assertThat(byTier.get(Tier.ENTERPRISE)).containsExactly("demo-key-enterprise");
    }
}
