package com.gatekeeper.policy;

import com.gatekeeper.config.GatekeeperProperties;
import com.gatekeeper.model.AlgorithmType;
import com.gatekeeper.model.EndpointPolicy;
import com.gatekeeper.model.Rate;
import com.gatekeeper.model.TierLimit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable tier and endpoint tables. Everything is parsed and validated in the
 * constructor so that a bad configuration stops the application context.
 */
@Slf4j
@Component
public class PolicyRegistry {

    public static final String UNLIMITED = "unlimited";

    private final Map<String, TierLimit> tierLimits;
    private final List<EndpointPolicy> endpointPolicies;
    private final EndpointMatcher endpointMatcher;
    private final String defaultTier;

    public PolicyRegistry(GatekeeperProperties properties) {
        this.tierLimits = Collections.unmodifiableMap(parseTiers(properties.getTiers()));
        this.defaultTier = properties.getDefaultTier();
        if (!tierLimits.containsKey(defaultTier)) {
            throw new PolicyConfigurationException("Default tier '" + defaultTier + "' has no limit configured");
        }
        this.endpointPolicies = List.copyOf(parseEndpoints(properties.getEndpoints()));
        this.endpointMatcher = new EndpointMatcher(endpointPolicies);
        validateIpPolicy(properties.getIp());

        log.info("Loaded {} tier limits and {} endpoint policies (default tier: {})",
                tierLimits.size(), endpointPolicies.size(), defaultTier);
        endpointPolicies.forEach(p -> log.debug("Endpoint policy {} -> {}", p.getPattern(), p.getDescription()));
    }

    // unknown tiers fall back to the default tier
    public TierLimit tierLimit(String tier) {
        if (tier != null) {
            TierLimit limit = tierLimits.get(tier.toLowerCase(Locale.ROOT));
            if (limit != null) {
                return limit;
            }
            log.debug("Unknown tier '{}', applying default tier '{}'", tier, defaultTier);
        }
        return tierLimits.get(defaultTier);
    }

    public Optional<EndpointPolicy> resolveEndpoint(String endpoint) {
        return endpointMatcher.findBestMatch(endpoint);
    }

    public Map<String, TierLimit> getTierLimits() {
        return tierLimits;
    }

    public List<EndpointPolicy> getEndpointPolicies() {
        return endpointPolicies;
    }

    public String getDefaultTier() {
        return defaultTier;
    }

    private static Map<String, TierLimit> parseTiers(Map<String, String> tiers) {
        Map<String, TierLimit> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : tiers.entrySet()) {
            String tier = entry.getKey().toLowerCase(Locale.ROOT);
            if (parsed.containsKey(tier)) {
                throw new PolicyConfigurationException(
                        "Tier '" + entry.getKey() + "' is configured twice (tier names are case-insensitive)");
            }
            String value = entry.getValue() == null ? "" : entry.getValue().trim();
            if (UNLIMITED.equalsIgnoreCase(value)) {
                parsed.put(tier, TierLimit.unlimited(tier));
                continue;
            }
            try {
                int rpm = Integer.parseInt(value);
                if (rpm < 0) {
                    parsed.put(tier, TierLimit.unlimited(tier));
                } else if (rpm == 0) {
                    throw new PolicyConfigurationException("Tier '" + tier + "' must allow at least one request per minute");
                } else {
                    parsed.put(tier, TierLimit.perMinute(tier, rpm));
                }
            } catch (NumberFormatException e) {
                throw new PolicyConfigurationException(
                        "Tier '" + tier + "' limit must be an integer or 'unlimited', got '" + value + "'", e);
            }
        }
        return parsed;
    }

    // the IP limiter is a sliding window with whole-second resolution
    private static void validateIpPolicy(GatekeeperProperties.Ip ip) {
        if (ip.getMaxRequests() <= 0) {
            throw new PolicyConfigurationException(
                    "IP policy max-requests must be positive, got " + ip.getMaxRequests());
        }
        if (ip.getWindow() == null || ip.getWindow().getSeconds() < 1) {
            throw new PolicyConfigurationException(
                    "IP policy window must be at least one second, got " + ip.getWindow());
        }
    }

    private static List<EndpointPolicy> parseEndpoints(List<GatekeeperProperties.Endpoint> endpoints) {
        List<EndpointPolicy> parsed = new ArrayList<>(endpoints.size());
        for (GatekeeperProperties.Endpoint endpoint : endpoints) {
            Rate rate = RateParser.parse(endpoint.getRateLimit());
            AlgorithmType algorithm = AlgorithmType.fromConfig(endpoint.getAlgorithm());
            Integer burst = endpoint.getBurstCapacity();
            if (burst != null && burst <= 0) {
                throw new PolicyConfigurationException(
                        "Burst capacity must be positive for endpoint " + endpoint.getPattern());
            }
            parsed.add(EndpointPolicy.builder()
                    .pattern(endpoint.getPattern())
                    .rateLimit(endpoint.getRateLimit())
                    .rate(rate)
                    .algorithm(algorithm)
                    .burstCapacity(burst)
                    .build());
        }
        return parsed;
    }
}
