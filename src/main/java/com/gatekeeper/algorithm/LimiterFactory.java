package com.gatekeeper.algorithm;

import com.gatekeeper.model.EndpointPolicy;
import com.gatekeeper.model.Rate;
import com.gatekeeper.storage.RateLimitStorage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

// builds limiters bound to the active storage backend and clock
@Component
@RequiredArgsConstructor
public class LimiterFactory {

    private final RateLimitStorage storage;
    private final Clock clock;

    public TokenBucketLimiter tokenBucket(double capacity, double refillRate, double refillPeriod) {
        return new TokenBucketLimiter(storage, clock, capacity, refillRate, refillPeriod);
    }

    public SlidingWindowLimiter slidingWindow(long windowSize, int maxRequests) {
        return new SlidingWindowLimiter(storage, clock, windowSize, maxRequests);
    }

    public FixedWindowLimiter fixedWindow(long windowSize, int maxRequests) {
        return new FixedWindowLimiter(storage, clock, windowSize, maxRequests);
    }

    // capacity = rpm, refilled at rpm/60 tokens per second
    public TokenBucketLimiter forTier(int requestsPerMinute) {
        return tokenBucket(requestsPerMinute, requestsPerMinute / 60.0, 1.0);
    }

    public RateLimitAlgorithm forEndpoint(EndpointPolicy policy) {
        Rate rate = policy.getRate();
        return switch (policy.getAlgorithm()) {
            case TOKEN_BUCKET -> tokenBucket(policy.effectiveBurstCapacity(), rate.perSecond(), 1.0);
            case FIXED_WINDOW -> fixedWindow(rate.getPeriodSeconds(), rate.getCount());
            case SLIDING_WINDOW -> slidingWindow(rate.getPeriodSeconds(), rate.getCount());
        };
    }
}
