package com.gatekeeper.model;

import lombok.Value;

/**
 * Fixed window snapshot. {@code windowStart} is the window index, not a timestamp.
 */
@Value
public class CounterState {
    long windowStart;
    long counter;

    public static CounterState empty(long windowStart) {
        return new CounterState(windowStart, 0);
    }
}
