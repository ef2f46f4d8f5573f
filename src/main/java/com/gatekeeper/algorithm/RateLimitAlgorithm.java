package com.gatekeeper.algorithm;

import com.gatekeeper.model.AlgorithmType;
import com.gatekeeper.model.RateLimitStatus;

/**
 * A configured limiter. Instances hold only their parameters; all per-key state lives
 * in the {@link com.gatekeeper.storage.RateLimitStorage} they were built with, so one
 * instance may serve any number of keys and may be discarded at any time.
 */
public interface RateLimitAlgorithm {

    /**
     * Check, and on success record, one request for {@code key} at the current time.
     *
     * @param key storage key, e.g. {@code "ip:10.0.0.1"}
     * @return true if the request is admitted
     */
    boolean isAllowed(String key);

    /**
     * Current limit, remaining quota and seconds until reset for {@code key}. Does not
     * consume quota.
     */
    RateLimitStatus status(String key);

    AlgorithmType getAlgorithmType();
}
