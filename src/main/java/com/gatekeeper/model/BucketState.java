package com.gatekeeper.model;

import lombok.Value;

/**
 * Token bucket snapshot. {@code lastRefill} is in epoch seconds.
 */
@Value
public class BucketState {
    double tokens;
    double lastRefill;

    public static BucketState full(double capacity, double now) {
        return new BucketState(capacity, now);
    }
}
