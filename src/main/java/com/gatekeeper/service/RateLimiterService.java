package com.gatekeeper.service;

import com.gatekeeper.algorithm.LimiterFactory;
import com.gatekeeper.algorithm.RateLimitAlgorithm;
import com.gatekeeper.config.GatekeeperProperties;
import com.gatekeeper.dto.LimiterStats;
import com.gatekeeper.model.EndpointPolicy;
import com.gatekeeper.model.LimitDimension;
import com.gatekeeper.model.RateLimitResult;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.model.RequestDescriptor;
import com.gatekeeper.model.TierLimit;
import com.gatekeeper.policy.PolicyRegistry;
import com.gatekeeper.storage.RateLimitStorage;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves which limiters apply to a request and combines their answers.
 *
 * <p>Dimensions are checked in the order IP, user, endpoint; the first one that rejects
 * is reported and the remaining ones are not consulted, so they consume no quota.
 */
@Slf4j
@Service
public class RateLimiterService {

    static final String IP_PREFIX = "ip:";
    static final String USER_PREFIX = "user:";
    static final String ENDPOINT_PREFIX = "endpoint:";

    private final PolicyRegistry policyRegistry;
    private final LimiterFactory limiterFactory;
    private final LimiterCache limiterCache;
    private final MetricsService metricsService;
    private final RateLimitStorage storage;
    private final GatekeeperProperties.Ip ipPolicy;
    private final boolean failOpen;

    public RateLimiterService(PolicyRegistry policyRegistry,
                              LimiterFactory limiterFactory,
                              LimiterCache limiterCache,
                              MetricsService metricsService,
                              RateLimitStorage storage,
                              GatekeeperProperties properties) {
        this.policyRegistry = policyRegistry;
        this.limiterFactory = limiterFactory;
        this.limiterCache = limiterCache;
        this.metricsService = metricsService;
        this.storage = storage;
        this.ipPolicy = properties.getIp();
        this.failOpen = properties.isFailOpen();
    }

    public boolean checkIpRateLimit(String ip) {
        String key = IP_PREFIX + ip;
        return check(LimitDimension.IP, key, () -> ipLimiter(key));
    }

    public boolean checkUserRateLimit(String userId, String tier) {
        TierLimit limit = policyRegistry.tierLimit(tier);
        if (limit.isUnlimited()) {
            return true;
        }
        String key = USER_PREFIX + userId;
        return check(LimitDimension.USER, key, () -> userLimiter(key, limit));
    }

    public boolean checkEndpointRateLimit(String endpoint) {
        Optional<EndpointPolicy> policy = policyRegistry.resolveEndpoint(endpoint);
        if (policy.isEmpty()) {
            return true;
        }
        String key = ENDPOINT_PREFIX + policy.get().getPattern();
        return check(LimitDimension.ENDPOINT, key, () -> endpointLimiter(key, policy.get()));
    }

    public RateLimitResult isAllowed(RequestDescriptor request) {
        return isAllowed(request.getIp(), request.getUserId(), request.getTier(), request.getEndpoint());
    }

    public RateLimitResult isAllowed(String ip, String userId, String tier, String endpoint) {
        long startTime = System.nanoTime();
        RateLimitResult result = evaluate(ip, userId, tier, endpoint);
        long latencyMicros = (System.nanoTime() - startTime) / 1000;
        metricsService.recordDecision(result.getReason(), latencyMicros);

        if (!result.isAllowed()) {
            log.info("Rate limit exceeded ({}) for ip={}, user={}, endpoint={}",
                    result.getReason().label(), ip, userId, endpoint);
        }
        return result;
    }

    private RateLimitResult evaluate(String ip, String userId, String tier, String endpoint) {
        if (hasText(ip) && !checkIpRateLimit(ip)) {
            return RateLimitResult.denied(LimitDimension.IP);
        }
        if (hasText(userId) && !checkUserRateLimit(userId, tier)) {
            return RateLimitResult.denied(LimitDimension.USER);
        }
        if (hasText(endpoint) && !checkEndpointRateLimit(endpoint)) {
            return RateLimitResult.denied(LimitDimension.ENDPOINT);
        }
        return RateLimitResult.allowed();
    }

    /**
     * Status of the most restrictive policy that applies to the request: the one with
     * the least remaining quota, the longest reset breaking ties. Never throws; a
     * dimension whose state cannot be read is left out.
     */
    public Optional<RateLimitStatus> currentStatus(RequestDescriptor request) {
        List<RateLimitStatus> statuses = new ArrayList<>(3);

        if (hasText(request.getIp())) {
            String key = IP_PREFIX + request.getIp();
            readStatus(LimitDimension.IP, key, () -> ipLimiter(key)).ifPresent(statuses::add);
        }
        if (hasText(request.getUserId())) {
            TierLimit limit = policyRegistry.tierLimit(request.getTier());
            if (!limit.isUnlimited()) {
                String key = USER_PREFIX + request.getUserId();
                readStatus(LimitDimension.USER, key, () -> userLimiter(key, limit)).ifPresent(statuses::add);
            }
        }
        if (hasText(request.getEndpoint())) {
            policyRegistry.resolveEndpoint(request.getEndpoint()).ifPresent(policy -> {
                String key = ENDPOINT_PREFIX + policy.getPattern();
                readStatus(LimitDimension.ENDPOINT, key, () -> endpointLimiter(key, policy)).ifPresent(statuses::add);
            });
        }

        return statuses.stream().min(RateLimitStatus.MOST_RESTRICTIVE_FIRST);
    }

    /**
     * Clears the stored quota of one client, user or endpoint policy so its next request
     * starts from a full allowance. An endpoint is resolved to the policy that governs it.
     * Storage failures are not masked here: the caller learns that nothing was reset.
     *
     * @return the storage key that was reset, or empty when no endpoint policy matches
     */
    public Optional<String> reset(LimitDimension dimension, String value) {
        if (!hasText(value)) {
            throw new IllegalArgumentException("A value to reset is required");
        }
        Optional<String> resolved = switch (dimension) {
            case IP -> Optional.of(IP_PREFIX + value);
            case USER -> Optional.of(USER_PREFIX + value);
            case ENDPOINT -> policyRegistry.resolveEndpoint(value).map(policy -> ENDPOINT_PREFIX + policy.getPattern());
            case NONE -> throw new IllegalArgumentException("Cannot reset dimension " + dimension);
        };
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        String key = resolved.get();
        storage.reset(key);
        if (dimension == LimitDimension.USER) {
            policyRegistry.getTierLimits().keySet().forEach(tier -> limiterCache.invalidate(key + "#" + tier));
        } else {
            limiterCache.invalidate(key);
        }
        log.info("Reset {} rate limit state for key: {}", dimension.label(), key);
        return Optional.of(key);
    }

    public LimiterStats stats() {
        CacheStats cacheStats = limiterCache.getStats();
        return LimiterStats.builder()
                .backend(storage.backendName())
                .cachedLimiters(limiterCache.size())
                .cacheHits(cacheStats.hitCount())
                .cacheMisses(cacheStats.missCount())
                .cacheEvictions(cacheStats.evictionCount())
                .cacheHitRate(limiterCache.getHitRate())
                .tiers(policyRegistry.getTierLimits().size())
                .endpointPolicies(policyRegistry.getEndpointPolicies().size())
                .failOpen(failOpen)
                .build();
    }

    public void clearLimiterCache() {
        limiterCache.invalidateAll();
    }

    private boolean check(LimitDimension dimension, String key, Supplier<RateLimitAlgorithm> limiter) {
        try {
            boolean allowed = limiter.get().isAllowed(key);
            metricsService.recordCheck(dimension, allowed);
            return allowed;
        } catch (RuntimeException e) {
            log.error("Rate limit storage failure on {} check for key: {} (fail-open={})",
                    dimension.label(), key, failOpen, e);
            metricsService.recordError(dimension);
            return failOpen;
        }
    }

    private Optional<RateLimitStatus> readStatus(LimitDimension dimension, String key,
                                                 Supplier<RateLimitAlgorithm> limiter) {
        try {
            return Optional.of(limiter.get().status(key));
        } catch (RuntimeException e) {
            log.warn("Could not read {} rate limit status for key: {}", dimension.label(), key, e);
            return Optional.empty();
        }
    }

    private RateLimitAlgorithm ipLimiter(String key) {
        return limiterCache.get(key, k -> limiterFactory.slidingWindow(
                ipPolicy.getWindow().getSeconds(), ipPolicy.getMaxRequests()));
    }

    // the tier is part of the cache key so that a tier change gets a correctly sized bucket
    private RateLimitAlgorithm userLimiter(String key, TierLimit limit) {
        return limiterCache.get(key + "#" + limit.getTier(),
                k -> limiterFactory.forTier(limit.getRequestsPerMinute()));
    }

    private RateLimitAlgorithm endpointLimiter(String key, EndpointPolicy policy) {
        return limiterCache.get(key, k -> {
            RateLimitAlgorithm limiter = limiterFactory.forEndpoint(policy);
            log.debug("Created {} limiter for {}", limiter.getAlgorithmType(), k);
            return limiter;
        });
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
