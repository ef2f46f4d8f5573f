package com.gatekeeper.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Informational view of one policy for a key, rendered as X-RateLimit-* headers.
 */
@Value
public class RateLimitStatus {

    // smallest remaining first, then the longest wait
    public static final Comparator<RateLimitStatus> MOST_RESTRICTIVE_FIRST =
            Comparator.comparingLong(RateLimitStatus::getRemaining)
                    .thenComparing(Comparator.comparingLong(RateLimitStatus::getResetSeconds).reversed());

    long limit;
    long remaining;
    long resetSeconds;

    public static RateLimitStatus of(long limit, long remaining, long resetSeconds) {
        return new RateLimitStatus(
                Math.max(0, limit),
                Math.max(0, Math.min(remaining, limit)),
                Math.max(0, resetSeconds));
    }
}
