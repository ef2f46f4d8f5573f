package com.gatekeeper.storage;

import com.gatekeeper.model.BucketState;
import com.gatekeeper.model.CounterState;
import com.gatekeeper.model.WindowDecision;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-local storage on Caffeine maps. Atomicity comes from {@code asMap().compute},
 * which locks a single key, so different keys never contend.
 *
 * <p>Idle keys are evicted after {@code idleEviction}; an evicted key behaves like a key
 * that was never seen (full bucket, empty window, zero counter). Cache maintenance runs
 * on the calling thread.
 */
@Slf4j
public class InMemoryRateLimitStorage implements RateLimitStorage {

    private final ConcurrentMap<String, BucketState> buckets;
    // deques are only touched inside compute for their key
    private final ConcurrentMap<String, Deque<Double>> windows;
    private final ConcurrentMap<String, CounterState> counters;

    public InMemoryRateLimitStorage() {
        this(100_000, Duration.ofDays(1));
    }

    public InMemoryRateLimitStorage(long maxKeys, Duration idleEviction) {
        this.buckets = this.<BucketState>newCache(maxKeys, idleEviction).asMap();
        this.windows = this.<Deque<Double>>newCache(maxKeys, idleEviction).asMap();
        this.counters = this.<CounterState>newCache(maxKeys, idleEviction).asMap();
        log.info("Initialized in-memory rate limit storage: maxKeys={}, idleEviction={}", maxKeys, idleEviction);
    }

    private <V> Cache<String, V> newCache(long maxKeys, Duration idleEviction) {
        return Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .expireAfterAccess(idleEviction)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public BucketState getBucketState(String key) {
        return buckets.get(key);
    }

    @Override
    public void updateBucketState(String key, BucketState state) {
        buckets.put(key, state);
    }

    @Override
    public BucketState updateBucket(String key, UnaryOperator<BucketState> transition) {
        return buckets.compute(key, (k, current) -> transition.apply(current));
    }

    @Override
    public long increment(String key, double timestamp) {
        AtomicLong size = new AtomicLong();
        windows.compute(key, (k, window) -> {
            Deque<Double> target = window != null ? window : new ArrayDeque<>();
            target.addLast(timestamp);
            size.set(target.size());
            return target;
        });
        return size.get();
    }

    @Override
    public void prune(String key, double cutoff) {
        windows.computeIfPresent(key, (k, window) -> {
            window.removeIf(ts -> ts <= cutoff);
            return window;
        });
    }

    @Override
    public long count(String key) {
        AtomicLong size = new AtomicLong();
        windows.computeIfPresent(key, (k, window) -> {
            size.set(window.size());
            return window;
        });
        return size.get();
    }

    @Override
    public OptionalDouble oldestTimestamp(String key) {
        AtomicReference<OptionalDouble> oldest = new AtomicReference<>(OptionalDouble.empty());
        windows.computeIfPresent(key, (k, window) -> {
            oldest.set(window.stream().mapToDouble(Double::doubleValue).min());
            return window;
        });
        return oldest.get();
    }

    @Override
    public WindowDecision slide(String key, double timestamp, double cutoff, int maxRequests) {
        AtomicReference<WindowDecision> decision = new AtomicReference<>();
        windows.compute(key, (k, window) -> {
            Deque<Double> target = window != null ? window : new ArrayDeque<>();
            target.removeIf(ts -> ts <= cutoff);
            boolean allowed = target.size() < maxRequests;
            if (allowed) {
                target.addLast(timestamp);
            }
            decision.set(new WindowDecision(allowed, target.size()));
            return target;
        });
        return decision.get();
    }

    @Override
    public CounterState getCounterState(String key) {
        return counters.get(key);
    }

    @Override
    public void updateCounterState(String key, CounterState state) {
        counters.put(key, state);
    }

    @Override
    public CounterState updateCounter(String key, UnaryOperator<CounterState> transition) {
        return counters.compute(key, (k, current) -> transition.apply(current));
    }

    @Override
    public void reset(String key) {
        buckets.remove(key);
        windows.remove(key);
        counters.remove(key);
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public String backendName() {
        return "memory";
    }
}
