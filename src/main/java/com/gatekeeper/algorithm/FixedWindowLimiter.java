package com.gatekeeper.algorithm;

import com.gatekeeper.model.AlgorithmType;
import com.gatekeeper.model.CounterState;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.storage.RateLimitStorage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed window counter over window index {@code floor(timestamp / windowSize)}.
 *
 * <p>Only one counter per key is kept. A burst straddling a boundary can see up to
 * twice {@code maxRequests} admitted within one window length.
 */
@Slf4j
@Getter
public class FixedWindowLimiter implements RateLimitAlgorithm {

    private final RateLimitStorage storage;
    private final Clock clock;
    private final long windowSize;
    private final int maxRequests;

    public FixedWindowLimiter(RateLimitStorage storage, Clock clock, long windowSize, int maxRequests) {
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

    public boolean isAllowed(String key, double timestamp) {
        long windowIndex = windowIndex(timestamp);
        AtomicBoolean allowed = new AtomicBoolean();
        CounterState stored = storage.updateCounter(key, current -> {
            CounterState state = current == null || current.getWindowStart() != windowIndex
                    ? CounterState.empty(windowIndex)
                    : current;
            if (state.getCounter() < maxRequests) {
                allowed.set(true);
                return new CounterState(windowIndex, state.getCounter() + 1);
            }
            allowed.set(false);
            return state;
        });

        log.debug("Fixed Window check for key={}, window={}: allowed={}, counter={}/{}",
                key, windowIndex, allowed.get(), stored.getCounter(), maxRequests);
        return allowed.get();
    }

    @Override
    public RateLimitStatus status(String key) {
        double now = Clocks.epochSeconds(clock);
        long windowIndex = windowIndex(now);
        CounterState state = storage.getCounterState(key);
        long used = state != null && state.getWindowStart() == windowIndex ? state.getCounter() : 0;
        long resetSeconds = (long) Math.ceil((windowIndex + 1) * windowSize - now);
        return RateLimitStatus.of(maxRequests, maxRequests - used, Math.min(windowSize, resetSeconds));
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.FIXED_WINDOW;
    }

    long windowIndex(double timestamp) {
        return (long) Math.floor(timestamp / windowSize);
    }
}
