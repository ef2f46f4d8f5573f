package com.gatekeeper.algorithm;

import com.gatekeeper.model.AlgorithmType;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.model.WindowDecision;
import com.gatekeeper.storage.RateLimitStorage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.OptionalDouble;

/**
 * Exact sliding window log. Every admitted request's timestamp is retained until it
 * falls out of the trailing window, so memory per key is bounded by
 * {@code maxRequests}.
 */
@Slf4j
@Getter
public class SlidingWindowLimiter implements RateLimitAlgorithm {

    private final RateLimitStorage storage;
    private final Clock clock;
    private final long windowSize;
    private final int maxRequests;

    public SlidingWindowLimiter(RateLimitStorage storage, Clock clock, long windowSize, int maxRequests) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("Max requests must be positive");
        }
        this.storage = storage;
        this.clock = clock;
        this.windowSize = windowSize;
        this.maxRequests = maxRequests;
    }

    @Override
    public boolean isAllowed(String key) {
        return isAllowed(key, Clocks.epochSeconds(clock));
    }

    /**
     * @param timestamp epoch seconds of the request; need not be monotonic
     */
    public boolean isAllowed(String key, double timestamp) {
        // prune happens before the count inside the same atomic step
        WindowDecision decision = storage.slide(key, timestamp, timestamp - windowSize, maxRequests);
        log.debug("Sliding Window check for key={}: allowed={}, count={}/{}",
                key, decision.isAllowed(), decision.getCount(), maxRequests);
        return decision.isAllowed();
    }

    @Override
    public RateLimitStatus status(String key) {
        double now = Clocks.epochSeconds(clock);
        storage.prune(key, now - windowSize);
        long count = storage.count(key);
        OptionalDouble oldest = storage.oldestTimestamp(key);
        long resetSeconds = 0;
        if (oldest.isPresent()) {
            resetSeconds = Math.min(windowSize, (long) Math.ceil(oldest.getAsDouble() + windowSize - now));
        }
        return RateLimitStatus.of(maxRequests, maxRequests - count, resetSeconds);
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.SLIDING_WINDOW;
    }
}
