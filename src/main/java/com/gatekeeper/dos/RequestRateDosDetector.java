package com.gatekeeper.dos;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Flags an IP that sends more than {@code maxRequests} requests inside {@code window},
 * counting every request it sees whether or not it is later admitted, and bans it for
 * {@code banDuration}. Tracking lives in a bounded Caffeine map, evicted once an IP has
 * been idle for longer than both the window and the ban.
 */
@Slf4j
public class RequestRateDosDetector implements DosDetector {

    private final Clock clock;
    private final int maxRequests;
    private final long windowMillis;
    private final long banMillis;
    private final ConcurrentMap<String, IpActivity> activity;

    public RequestRateDosDetector(Clock clock, int maxRequests, Duration window, Duration banDuration, long maxTrackedIps) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("DoS threshold must be positive");
        }
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.banMillis = banDuration.toMillis();
        Duration idle = window.compareTo(banDuration) > 0 ? window : banDuration;
        this.activity = Caffeine.newBuilder()
                .maximumSize(maxTrackedIps)
                .expireAfterAccess(idle)
                .executor(Runnable::run)
                .<String, IpActivity>build()
                .asMap();
    }

    @Override
    public boolean isAttack(String ip) {
        long now = clock.millis();
        AtomicBoolean attack = new AtomicBoolean();
        activity.compute(ip, (k, current) -> {
            IpActivity state = current != null ? current : new IpActivity();
            if (state.bannedUntil > now) {
                attack.set(true);
                return state;
            }
            state.requests.removeIf(ts -> ts <= now - windowMillis);
            state.requests.addLast(now);
            if (state.requests.size() > maxRequests) {
                state.bannedUntil = now + banMillis;
                state.requests.clear();
                attack.set(true);
                log.warn("DoS pattern detected from ip={}: more than {} requests in {}ms, banned for {}ms",
                        ip, maxRequests, windowMillis, banMillis);
            }
            return state;
        });
        return attack.get();
    }

    @Override
    public long banRemainingSeconds(String ip) {
        IpActivity state = activity.get(ip);
        if (state == null) {
            return 0;
        }
        long remaining = state.bannedUntil - clock.millis();
        return remaining > 0 ? (long) Math.ceil(remaining / 1000.0) : 0;
    }

    private static final class IpActivity {
        private final Deque<Long> requests = new ArrayDeque<>();
        private volatile long bannedUntil;
    }
}
