package com.gatekeeper.model;

import java.util.Locale;

// the dimension a request was rejected on; NONE when it was admitted
public enum LimitDimension {
    IP,
    USER,
    ENDPOINT,
    NONE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a selector such as {@code "ip"} or {@code "USER"}. {@code NONE} is not a selector.
     */
    public static LimitDimension fromSelector(String selector) {
        if (selector != null) {
            for (LimitDimension dimension : values()) {
                if (dimension != NONE && dimension.label().equalsIgnoreCase(selector.trim())) {
                    return dimension;
                }
            }
        }
        throw new IllegalArgumentException("Unknown limit dimension: " + selector + " (expected ip, user or endpoint)");
    }
}
