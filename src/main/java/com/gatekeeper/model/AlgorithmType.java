package com.gatekeeper.model;

import com.gatekeeper.policy.PolicyConfigurationException;

import java.util.Locale;

public enum AlgorithmType {
    TOKEN_BUCKET,
    SLIDING_WINDOW,
    FIXED_WINDOW;

    // accepts "token_bucket", "token-bucket" and "TOKEN_BUCKET"; null means the default
    public static AlgorithmType fromConfig(String name) {
        if (name == null || name.isBlank()) {
            return SLIDING_WINDOW;
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (AlgorithmType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new PolicyConfigurationException("Unknown rate limit algorithm: " + name);
    }
}
