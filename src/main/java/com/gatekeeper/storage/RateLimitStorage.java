package com.gatekeeper.storage;

import com.gatekeeper.model.BucketState;
import com.gatekeeper.model.CounterState;
import com.gatekeeper.model.WindowDecision;

import java.util.OptionalDouble;
import java.util.function.UnaryOperator;

/**
 * State store shared by the limiter algorithms. Bucket, window and counter state live
 * in separate namespaces, so the same key may be used by more than one algorithm.
 *
 * <p>The plain getters and setters are single operations. The {@code update*} and
 * {@link #slide} methods are atomic read-modify-write steps: concurrent callers on the
 * same key are serialized and never lose an update. Implementations report backend
 * failures as {@link RateLimitStorageException}.
 */
public interface RateLimitStorage {

    /**
     * @return the stored bucket, or null when the key has never been seen
     */
    BucketState getBucketState(String key);

    void updateBucketState(String key, BucketState state);

    /**
     * Atomically replaces the bucket with {@code transition.apply(current)}. The current
     * value passed in is null for an unseen key. The transition may be invoked more than
     * once by optimistic backends and must not have side effects beyond its result.
     *
     * @return the state that was stored
     */
    BucketState updateBucket(String key, UnaryOperator<BucketState> transition);

    /**
     * Records a request timestamp in the sliding window of {@code key}.
     *
     * @return number of timestamps held for the key afterwards
     */
    long increment(String key, double timestamp);

    /**
     * Drops every timestamp less than or equal to {@code cutoff}.
     */
    void prune(String key, double cutoff);

    long count(String key);

    OptionalDouble oldestTimestamp(String key);

    /**
     * Atomically prunes timestamps {@code <= cutoff}, then records {@code timestamp} only
     * if fewer than {@code maxRequests} remain.
     */
    WindowDecision slide(String key, double timestamp, double cutoff, int maxRequests);

    /**
     * @return the stored counter, or null when the key has never been seen
     */
    CounterState getCounterState(String key);

    void updateCounterState(String key, CounterState state);

    /**
     * Counter equivalent of {@link #updateBucket}.
     */
    CounterState updateCounter(String key, UnaryOperator<CounterState> transition);

    /**
     * Forgets every bucket, window and counter stored under {@code key}. Afterwards the
     * key behaves like one that was never seen. Unknown keys are ignored.
     */
    void reset(String key);

    /**
     * Cheap connectivity check used by the health indicator.
     */
    void ping();

    String backendName();
}
