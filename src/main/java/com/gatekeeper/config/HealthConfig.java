package com.gatekeeper.config;

import com.gatekeeper.model.AlgorithmType;
import com.gatekeeper.policy.PolicyRegistry;
import com.gatekeeper.storage.RateLimitStorage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

@Configuration
public class HealthConfig {

    // ─── Storage: reachability + round-trip latency ──────────────────
    @Bean
    public HealthIndicator rateLimitStorageHealthIndicator(
            RateLimitStorage storage,
            @Value("${gatekeeper.health.storage-warn-latency-ms:50}") long warnMs,
            @Value("${gatekeeper.health.storage-down-latency-ms:100}") long downMs) {
        return () -> storageHealth(storage, warnMs, downMs);
    }

    // ─── Policy tables loaded at startup ─────────────────────────────
    @Bean
    public HealthIndicator rateLimitPolicyHealthIndicator(PolicyRegistry policyRegistry) {
        return () -> Health.up()
                .withDetail("algorithms", Arrays.stream(AlgorithmType.values()).map(Enum::name).toList())
                .withDetail("defaultTier", policyRegistry.getDefaultTier())
                .withDetail("tiers", policyRegistry.getTierLimits().size())
                .withDetail("endpointPolicies", policyRegistry.getEndpointPolicies().size())
                .build();
    }

    static Health storageHealth(RateLimitStorage storage, long warnMs, long downMs) {
        String backend = storage.backendName();
        long latencyMs;
        try {
            long t0 = System.nanoTime();
            storage.ping();
            latencyMs = (System.nanoTime() - t0) / 1_000_000;
        } catch (RuntimeException e) {
            // requests keep flowing under fail-open, but nothing is being enforced
            return Health.down(e)
                    .withDetail("backend", backend)
                    .withDetail("error", "Cannot reach rate limit storage")
                    .build();
        }

        if (latencyMs > downMs) {
            return Health.down()
                    .withDetail("backend", backend)
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("reason", "Storage latency " + latencyMs + "ms > " + downMs + "ms threshold")
                    .build();
        }
        Health.Builder up = Health.up()
                .withDetail("backend", backend)
                .withDetail("latencyMs", latencyMs);
        if (latencyMs > warnMs) {
            up.withDetail("warning", "Storage latency " + latencyMs + "ms approaching threshold");
        }
        return up.build();
    }
}
