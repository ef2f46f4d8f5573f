package com.gatekeeper.algorithm;

import java.time.Clock;

final class Clocks {

    private Clocks() {
    }

    static double epochSeconds(Clock clock) {
        return clock.millis() / 1000.0;
    }
}
