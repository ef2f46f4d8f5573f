package com.gatekeeper.algorithm;

import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.storage.InMemoryRateLimitStorage;
import com.gatekeeper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowLimiterTest {

    private InMemoryRateLimitStorage storage;
    private MutableClock clock;
    private SlidingWindowLimiter limiter;

    @BeforeEach
    void setUp() {
        storage = new InMemoryRateLimitStorage();
        clock = MutableClock.atEpochSeconds(1_000);
        limiter = new SlidingWindowLimiter(storage, clock, 3, 2);
    }

    @Test
    void shouldSlideWithExplicitTimestamps() {
        assertThat(limiter.isAllowed("k", 1_000)).isTrue();
        assertThat(limiter.isAllowed("k", 1_001)).isTrue();
        assertThat(limiter.isAllowed("k", 1_002)).isFalse();
        // 1000 falls out at 1003, 1001 at 1004
        assertThat(limiter.isAllowed("k", 1_004)).isTrue();
    }

    @Test
    void shouldNotRecordRejectedRequests() {
        limiter.isAllowed("k", 1_000);
        limiter.isAllowed("k", 1_001);
        limiter.isAllowed("k", 1_002);

        assertThat(storage.count("k")).isEqualTo(2);
    }

    @Test
    void shouldTreatTimestampOnBoundaryAsExpired() {
        limiter.isAllowed("k", 1_000);
        limiter.isAllowed("k", 1_000.5);

        assertThat(limiter.isAllowed("k", 1_003)).isTrue();
    }

    @Test
    void shouldUseClockWhenNoTimestampGiven() {
        assertThat(limiter.isAllowed("k")).isTrue();
        assertThat(limiter.isAllowed("k")).isTrue();
        assertThat(limiter.isAllowed("k")).isFalse();

        clock.advanceSeconds(3.5);

        assertThat(limiter.isAllowed("k")).isTrue();
    }

    @Test
    void statusShouldReportCountAndTimeUntilOldestExpires() {
        limiter.isAllowed("k", 1_000);
        clock.setEpochSeconds(1_001);
        limiter.isAllowed("k");

        RateLimitStatus status = limiter.status("k");

        assertThat(status.getLimit()).isEqualTo(2);
        assertThat(status.getRemaining()).isZero();
        assertThat(status.getResetSeconds()).isEqualTo(2);
    }

    @Test
    void statusShouldBeFullWhenWindowIsEmpty() {
        RateLimitStatus status = limiter.status("unused");

        assertThat(status.getRemaining()).isEqualTo(2);
        assertThat(status.getResetSeconds()).isZero();
    }

    @Test
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new SlidingWindowLimiter(storage, clock, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowLimiter(storage, clock, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
