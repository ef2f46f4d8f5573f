package com.gatekeeper.algorithm;

import com.gatekeeper.model.AlgorithmType;
import com.gatekeeper.model.BucketState;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.storage.RateLimitStorage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token bucket with lazy refill: {@code refillRate} tokens are added per
 * {@code refillPeriod} seconds, computed from the elapsed time on each access and capped
 * at {@code capacity}. A new key starts with a full bucket.
 */
@Slf4j
@Getter
public class TokenBucketLimiter implements RateLimitAlgorithm {

    private final RateLimitStorage storage;
    private final Clock clock;
    private final double capacity;
    private final double refillRate;
    private final double refillPeriod;

    public TokenBucketLimiter(RateLimitStorage storage, Clock clock,
                              double capacity, double refillRate, double refillPeriod) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("Refill rate must be positive");
        }
        if (refillPeriod <= 0) {
            throw new IllegalArgumentException("Refill period must be positive");
        }
        this.storage = storage;
        this.clock = clock;
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.refillPeriod = refillPeriod;
    }

    @Override
    public boolean isAllowed(String key) {
        return isAllowed(key, 1);
    }

    public boolean isAllowed(String key, int tokensRequested) {
        if (tokensRequested < 1) {
            throw new IllegalArgumentException("Tokens requested must be at least 1");
        }
        // can never be satisfied; reject instead of waiting
        if (tokensRequested > capacity) {
            log.debug("Token Bucket key={} asked for {} tokens, capacity is {}", key, tokensRequested, capacity);
            return false;
        }

        double now = Clocks.epochSeconds(clock);
        AtomicBoolean allowed = new AtomicBoolean();
        BucketState stored = storage.updateBucket(key, current -> {
            BucketState refilled = refill(current, now);
            if (refilled.getTokens() >= tokensRequested) {
                allowed.set(true);
                return new BucketState(refilled.getTokens() - tokensRequested, refilled.getLastRefill());
            }
            allowed.set(false);
            return refilled;
        });

        log.debug("Token Bucket check for key={}: allowed={}, remaining={}", key, allowed.get(), stored.getTokens());
        return allowed.get();
    }

    @Override
    public RateLimitStatus status(String key) {
        double now = Clocks.epochSeconds(clock);
        BucketState refilled = refill(storage.getBucketState(key), now);
        double missing = capacity - refilled.getTokens();
        long resetSeconds = (long) Math.ceil(missing / tokensPerSecond());
        return RateLimitStatus.of((long) capacity, (long) Math.floor(refilled.getTokens()), resetSeconds);
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.TOKEN_BUCKET;
    }

    BucketState refill(BucketState current, double now) {
        if (current == null) {
            return BucketState.full(capacity, now);
        }
        // a caller that read the clock earlier may commit after a later one
        double elapsed = Math.max(0.0, now - current.getLastRefill());
        double tokens = Math.max(0.0, Math.min(capacity, current.getTokens()));
        tokens = Math.min(capacity, tokens + elapsed / refillPeriod * refillRate);
        return new BucketState(tokens, Math.max(now, current.getLastRefill()));
    }

    private double tokensPerSecond() {
        return refillRate / refillPeriod;
    }
}
