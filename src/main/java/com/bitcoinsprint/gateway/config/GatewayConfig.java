package com.bitcoinsprint.gateway.config;

import com.bitcoinsprint.gateway.auth.ApiKeyHashService;
import com.bitcoinsprint.gateway.auth.ApiKeyRegistry;
import com.bitcoinsprint.gateway.backend.BackendClient;
import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import com.bitcoinsprint.gateway.ratelimit.TierRateLimiter;
import com.bitcoinsprint.gateway.tier.TierPolicy;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core collaborators of the request pipeline, built once from {@link GatewayProperties}.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    TierPolicy tierPolicy(GatewayProperties props) {
        TierPolicy policy = new TierPolicy(props::policyFor);
        policy.all().forEach((tier, limits) -> log.info("Tier {} limits {}", tier.wireName(), limits));
        return policy;
    }

    @Bean
    ApiKeyRegistry apiKeyRegistry(GatewayProperties props, ApiKeyHashService hashService) {
        ApiKeyRegistry registry = new ApiKeyRegistry(props.getApiKeys(), hashService);
        log.info("Loaded {} API keys", registry.size());
        return registry;
    }

    @Bean
    TierRateLimiter tierRateLimiter(TierPolicy tierPolicy, GatewayProperties props) {
        return new TierRateLimiter(tierPolicy, props.getRateLimit().getIdleTtl());
    }

    /** Uses Boot's Prometheus registry when export is enabled, a private one otherwise. */
    @Bean
    GatewayMetrics gatewayMetrics(ObjectProvider<PrometheusMeterRegistry> registry) {
        return new GatewayMetrics(registry.getIfAvailable(() -> new PrometheusMeterRegistry(PrometheusConfig.DEFAULT)));
    }

    @Bean
    BackendClient backendClient(GatewayProperties props, GatewayMetrics metrics) {
        GatewayProperties.Backend b = props.getBackend();
        log.info("Backend {} timeout={} connectTimeout={}", b.getBaseUrl(), b.getTimeout(), b.getConnectTimeout());
        return new BackendClient(b.getBaseUrl(), b.getConnectTimeout(), b.getTimeout(), metrics);
    }
}
