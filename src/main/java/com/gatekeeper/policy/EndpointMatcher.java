package com.gatekeeper.policy;

import com.gatekeeper.model.EndpointPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the endpoint policy for a route: an exact pattern wins, otherwise the
 * longest matching prefix wildcard ({@code "/api/*"}).
 */
@Slf4j
public class EndpointMatcher {

    private final Map<String, EndpointPolicy> exact = new HashMap<>();
    // longest prefix first
    private final List<EndpointPolicy> wildcards;

    public EndpointMatcher(List<EndpointPolicy> policies) {
        Set<String> seen = new HashSet<>();
        for (EndpointPolicy policy : policies) {
            validatePattern(policy.getPattern());
            if (!seen.add(policy.getPattern())) {
                throw new PolicyConfigurationException("Duplicate endpoint pattern: " + policy.getPattern());
            }
            if (!policy.isWildcard()) {
                exact.put(policy.getPattern(), policy);
            }
        }
        this.wildcards = policies.stream()
                .filter(EndpointPolicy::isWildcard)
                .sorted(Comparator.comparingInt((EndpointPolicy p) -> calculatePriority(p.getPattern())).reversed())
                .toList();
    }

    public Optional<EndpointPolicy> findBestMatch(String endpoint) {
        if (endpoint == null) {
            return Optional.empty();
        }
        EndpointPolicy match = exact.get(endpoint);
        if (match != null) {
            return Optional.of(match);
        }
        for (EndpointPolicy wildcard : wildcards) {
            if (endpoint.startsWith(wildcard.prefix())) {
                return Optional.of(wildcard);
            }
        }
        return Optional.empty();
    }

    // exact patterns outrank every wildcard; longer wildcard prefixes outrank shorter ones
    public static int calculatePriority(String pattern) {
        if (!pattern.endsWith("*")) {
            return Integer.MAX_VALUE;
        }
        return pattern.length() - 1;
    }

    private static void validatePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new PolicyConfigurationException("Endpoint pattern must not be blank");
        }
        int star = pattern.indexOf('*');
        if (star >= 0 && star != pattern.length() - 1) {
            throw new PolicyConfigurationException(
                    "Wildcard is only supported as the last character: " + pattern);
        }
    }
}
