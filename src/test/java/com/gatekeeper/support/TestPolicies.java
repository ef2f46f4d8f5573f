package com.gatekeeper.support;

import com.gatekeeper.config.GatekeeperProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// the sample policy tables from application.yml, built in code for unit tests
public final class TestPolicies {

    private TestPolicies() {
    }

    public static GatekeeperProperties sampleProperties() {
        GatekeeperProperties properties = new GatekeeperProperties();
        Map<String, String> tiers = new LinkedHashMap<>();
        tiers.put("free", "60");
        tiers.put("premium", "300");
        tiers.put("enterprise", "1000");
        tiers.put("admin", "unlimited");
        properties.setTiers(tiers);
        properties.setEndpoints(List.of(
                endpoint("/api/auth/login", "5 per 5 minutes", "sliding_window", null),
                endpoint("/api/bulk/export", "1 per 10 seconds", "fixed_window", null),
                endpoint("/api/bulk/*", "1 per 1 minute", "token_bucket", 1),
                endpoint("/api/search", "30 per 1 minute", "token_bucket", 10),
                endpoint("/api/*", "1000 per 1 hour", null, null)));
        return properties;
    }

    public static GatekeeperProperties.Endpoint endpoint(String pattern, String rateLimit,
                                                         String algorithm, Integer burstCapacity) {
        GatekeeperProperties.Endpoint endpoint = new GatekeeperProperties.Endpoint();
        endpoint.setPattern(pattern);
        endpoint.setRateLimit(rateLimit);
        endpoint.setAlgorithm(algorithm);
        endpoint.setBurstCapacity(burstCapacity);
        return endpoint;
    }
}
