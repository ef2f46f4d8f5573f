package com.gatekeeper.model;

import lombok.Value;

@Value
public class RateLimitResult {

    private static final RateLimitResult ALLOWED = new RateLimitResult(true, LimitDimension.NONE);

    boolean allowed;
    LimitDimension reason;

    public static RateLimitResult allowed() {
        return ALLOWED;
    }

    public static RateLimitResult denied(LimitDimension reason) {
        return new RateLimitResult(false, reason);
    }
}
