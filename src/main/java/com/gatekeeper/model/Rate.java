package com.gatekeeper.model;

import lombok.Value;

// "count requests per periodSeconds"
@Value
public class Rate {
    int count;
    long periodSeconds;

    public double perSecond() {
        return (double) count / periodSeconds;
    }

    @Override
    public String toString() {
        return count + " per " + periodSeconds + "s";
    }
}
