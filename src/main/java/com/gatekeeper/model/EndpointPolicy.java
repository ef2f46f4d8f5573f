package com.gatekeeper.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EndpointPolicy {
    String pattern;
    String rateLimit;
    Rate rate;
    AlgorithmType algorithm;
    // null unless configured; only token bucket policies use it
    Integer burstCapacity;

    public boolean isWildcard() {
        return pattern.endsWith("*");
    }

    public String prefix() {
        return isWildcard() ? pattern.substring(0, pattern.length() - 1) : pattern;
    }

    public int effectiveBurstCapacity() {
        return burstCapacity != null ? burstCapacity : rate.getCount();
    }

    public String getDescription() {
        return switch (algorithm) {
            case TOKEN_BUCKET ->
                String.format("Token Bucket: %d capacity, refills %s", effectiveBurstCapacity(), rate);
            case SLIDING_WINDOW ->
                String.format("Sliding Window: %d requests per %ds", rate.getCount(), rate.getPeriodSeconds());
            case FIXED_WINDOW ->
                String.format("Fixed Window: %d requests per %ds window", rate.getCount(), rate.getPeriodSeconds());
        };
    }
}
