package com.gatekeeper.model;

import lombok.Value;

// outcome of one atomic sliding window step: whether the timestamp was recorded and the count afterwards
@Value
public class WindowDecision {
    boolean allowed;
    long count;
}
