package com.gatekeeper.service;

import com.gatekeeper.algorithm.RateLimitAlgorithm;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.function.Function;

/**
 * Bounded cache of limiter instances, keyed per IP, user or endpoint.
 * Limiters carry no state of their own, so eviction only costs a re-creation.
 */
@Slf4j
@Component
public class LimiterCache {

    @Value("${gatekeeper.limiter-cache.max-size:100000}")
    private long maxSize;

    @Value("${gatekeeper.limiter-cache.expire-after-access:1h}")
    private Duration expireAfterAccess;

    @Value("${gatekeeper.limiter-cache.enable-stats:true}")
    private boolean enableStats;

    private Cache<String, RateLimitAlgorithm> cache;

    @PostConstruct
    public void init() {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(expireAfterAccess)
                .executor(Runnable::run);

        if (enableStats) {
            cacheBuilder.recordStats();
        }

        this.cache = cacheBuilder.build();

        log.info("Initialized limiter cache: maxSize={}, expireAfterAccess={}, stats={}",
                maxSize, expireAfterAccess, enableStats);
    }

    /**
     * Get the limiter for a key, creating it with {@code factory} on first use.
     */
    public RateLimitAlgorithm get(String key, Function<String, RateLimitAlgorithm> factory) {
        return cache.get(key, factory);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
        log.debug("Invalidated limiter for key: {}", key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Invalidated all cached limiters");
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * @return hit rate (0.0 to 100.0), or -1 if stats are disabled
     */
    public double getHitRate() {
        if (!enableStats) {
            return -1.0;
        }
        CacheStats stats = cache.stats();
        long total = stats.requestCount();
        if (total == 0) {
            return 0.0;
        }
        return (stats.hitCount() * 100.0) / total;
    }
}
