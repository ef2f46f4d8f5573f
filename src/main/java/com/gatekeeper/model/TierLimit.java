package com.gatekeeper.model;

import lombok.Value;

@Value
public class TierLimit {
    String tier;
    int requestsPerMinute;
    boolean unlimited;

    public static TierLimit unlimited(String tier) {
        return new TierLimit(tier, -1, true);
    }

    public static TierLimit perMinute(String tier, int requestsPerMinute) {
        return new TierLimit(tier, requestsPerMinute, false);
    }
}
