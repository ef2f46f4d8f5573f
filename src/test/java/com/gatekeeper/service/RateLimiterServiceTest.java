package com.gatekeeper.service;

import com.gatekeeper.algorithm.LimiterFactory;
import com.gatekeeper.config.GatekeeperProperties;
import com.gatekeeper.dto.LimiterStats;
import com.gatekeeper.model.LimitDimension;
import com.gatekeeper.model.RateLimitResult;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.model.RequestDescriptor;
import com.gatekeeper.policy.PolicyRegistry;
import com.gatekeeper.storage.InMemoryRateLimitStorage;
import com.gatekeeper.storage.RateLimitStorage;
import com.gatekeeper.storage.RateLimitStorageException;
import com.gatekeeper.support.Limiters;
import com.gatekeeper.support.MutableClock;
import com.gatekeeper.support.TestPolicies;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimiterServiceTest {

    private static final String UNMATCHED = "/static/app.js";

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private GatekeeperProperties properties;
    private RateLimiterService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSeconds(1_700_000_000);
        meterRegistry = new SimpleMeterRegistry();
        properties = TestPolicies.sampleProperties();
        service = newService(new InMemoryRateLimitStorage());
    }

    private RateLimiterService newService(RateLimitStorage storage) {
        return new RateLimiterService(
                new PolicyRegistry(properties),
                new LimiterFactory(storage, clock),
                Limiters.cache(1_000, Duration.ofHours(1)),
                new MetricsService(meterRegistry),
                storage,
                properties);
    }

    @Test
    void shouldDenyFreeTierUserAfterSixtyRequestsInAMinute() {
        for (int i = 0; i < 60; i++) {
            assertThat(service.isAllowed(null, "alice", "free", UNMATCHED).isAllowed()).isTrue();
        }

        RateLimitResult result = service.isAllowed(null, "alice", "free", UNMATCHED);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).isEqualTo(LimitDimension.USER);
    }

    @Test
    void shouldRefillUserQuotaOverTime() {
        for (int i = 0; i < 60; i++) {
            service.checkUserRateLimit("bob", "free");
        }
        assertThat(service.checkUserRateLimit("bob", "free")).isFalse();

        clock.advanceSeconds(1);

        assertThat(service.checkUserRateLimit("bob", "free")).isTrue();
    }

    @Test
    void shouldApplyDefaultTierToUnknownTier() {
        for (int i = 0; i < 60; i++) {
            service.checkUserRateLimit("carol", "platinum");
        }

        assertThat(service.checkUserRateLimit("carol", "platinum")).isFalse();
    }

    @Test
    void shouldNeverLimitUnlimitedTier() {
        for (int i = 0; i < 500; i++) {
            assertThat(service.checkUserRateLimit("root", "admin")).isTrue();
        }
    }

    @Test
    void shouldDenyIpAfterIpPolicyIsExhaustedAndStopThere() {
        for (int i = 0; i < 100; i++) {
            assertThat(service.isAllowed("10.0.0.1", null, null, UNMATCHED).isAllowed()).isTrue();
        }

        RateLimitResult result = service.isAllowed("10.0.0.1", "dave", "free", UNMATCHED);

        assertThat(result.getReason()).isEqualTo(LimitDimension.IP);
        // the user check was never reached, so dave still has a full bucket
        for (int i = 0; i < 60; i++) {
            assertThat(service.checkUserRateLimit("dave", "free")).isTrue();
        }
    }

    @Test
    void shouldPreferExactEndpointPolicyOverWildcard() {
        for (int i = 0; i < 5; i++) {
            assertThat(service.checkEndpointRateLimit("/api/auth/login")).isTrue();
        }

        RateLimitResult result = service.isAllowed(null, null, null, "/api/auth/login");

        assertThat(result.getReason()).isEqualTo(LimitDimension.ENDPOINT);
        assertThat(service.checkEndpointRateLimit("/api/users")).isTrue();
    }

    @Test
    void shouldShareOneQuotaAcrossRoutesMatchingTheSameWildcard() {
        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isTrue();

        assertThat(service.checkEndpointRateLimit("/api/bulk/delete")).isFalse();
        assertThat(service.checkEndpointRateLimit("/api/bulk/export")).isTrue();
    }

    @Test
    void shouldAllowEndpointWithoutPolicy() {
        for (int i = 0; i < 10_000; i++) {
            assertThat(service.checkEndpointRateLimit(UNMATCHED)).isTrue();
        }
    }

    @Test
    void shouldFailOpenWhenStorageThrows() {
        RateLimitStorage broken = mock(RateLimitStorage.class);
        RateLimitStorageException failure = new RateLimitStorageException("backend down");
        when(broken.slide(anyString(), anyDouble(), anyDouble(), anyInt())).thenThrow(failure);
        when(broken.updateBucket(anyString(), any())).thenThrow(failure);
        when(broken.updateCounter(anyString(), any())).thenThrow(failure);
        RateLimiterService failing = newService(broken);

        RateLimitResult result = failing.isAllowed("10.0.0.1", "erin", "free", "/api/search");

        assertThat(result.isAllowed()).isTrue();
        assertThat(meterRegistry.find("gatekeeper.errors").counters()).hasSize(3);
    }

    @Test
    void shouldFailClosedWhenConfigured() {
        properties.setFailOpen(false);
        RateLimitStorage broken = mock(RateLimitStorage.class);
        when(broken.slide(anyString(), anyDouble(), anyDouble(), anyInt()))
                .thenThrow(new RateLimitStorageException("backend down"));
        RateLimiterService failing = newService(broken);

        RateLimitResult result = failing.isAllowed("10.0.0.1", null, null, UNMATCHED);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).isEqualTo(LimitDimension.IP);
    }

    @Test
    void shouldRecordDecisionMetrics() {
        service.isAllowed("10.0.0.2", "frank", "free", UNMATCHED);

        assertThat(meterRegistry.counter("gatekeeper.decisions.total", "reason", "none").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("gatekeeper.checks.total", "dimension", "ip", "result", "allowed").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.timer("gatekeeper.check.duration").count()).isEqualTo(1);
    }

    @Test
    void currentStatusShouldReportMostRestrictivePolicy() {
        RequestDescriptor request = RequestDescriptor.builder()
                .ip("10.0.0.3")
                .userId("gina")
                .tier("free")
                .endpoint("/api/auth/login")
                .build();
        for (int i = 0; i < 5; i++) {
            service.isAllowed(request);
        }

        Optional<RateLimitStatus> status = service.currentStatus(request);

        assertThat(status).isPresent();
        assertThat(status.get().getLimit()).isEqualTo(5);
        assertThat(status.get().getRemaining()).isZero();
        assertThat(status.get().getResetSeconds()).isBetween(0L, 300L);
    }

    @Test
    void currentStatusShouldNotConsumeQuota() {
        RequestDescriptor request = RequestDescriptor.builder().endpoint("/api/bulk/import").build();

        service.currentStatus(request);
        service.currentStatus(request);

        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isTrue();
    }

    @Test
    void currentStatusShouldBeEmptyWhenNothingApplies() {
        RequestDescriptor request = RequestDescriptor.builder().userId("root").tier("admin").endpoint(UNMATCHED).build();

        assertThat(service.currentStatus(request)).isEmpty();
    }

    @Test
    void shouldAdmitExactlyBurstCapacityUnderConcurrency() throws Exception {
        // /api/search: token bucket with burst 10; the clock does not move
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                int admitted = 0;
                for (int i = 0; i < 5; i++) {
                    if (service.isAllowed(null, null, null, "/api/search").isAllowed()) {
                        admitted++;
                    }
                }
                return admitted;
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> f : futures) {
            total += f.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(total).isEqualTo(10);
    }

    @Test
    void resetShouldRestoreExhaustedIpQuota() {
        for (int i = 0; i < 100; i++) {
            service.checkIpRateLimit("10.0.0.9");
        }
        assertThat(service.checkIpRateLimit("10.0.0.9")).isFalse();

        assertThat(service.reset(LimitDimension.IP, "10.0.0.9")).contains("ip:10.0.0.9");

        assertThat(service.checkIpRateLimit("10.0.0.9")).isTrue();
    }

    @Test
    void resetShouldRestoreUserQuotaWhateverTheTier() {
        for (int i = 0; i < 60; i++) {
            service.checkUserRateLimit("hank", "free");
        }
        assertThat(service.checkUserRateLimit("hank", "free")).isFalse();

        service.reset(LimitDimension.USER, "hank");

        assertThat(service.checkUserRateLimit("hank", "free")).isTrue();
    }

    @Test
    void resetShouldResolveRouteToItsEndpointPolicy() {
        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isTrue();
        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isFalse();

        assertThat(service.reset(LimitDimension.ENDPOINT, "/api/bulk/delete")).contains("endpoint:/api/bulk/*");

        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isTrue();
    }

    @Test
    void resetShouldReportEndpointWithoutPolicy() {
        assertThat(service.reset(LimitDimension.ENDPOINT, UNMATCHED)).isEmpty();
    }

    @Test
    void resetShouldRejectMissingValue() {
        assertThatThrownBy(() -> service.reset(LimitDimension.IP, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetShouldPropagateStorageFailure() {
        RateLimitStorage broken = mock(RateLimitStorage.class);
        doThrow(new RateLimitStorageException("backend down")).when(broken).reset(anyString());
        RateLimiterService failing = newService(broken);

        assertThatThrownBy(() -> failing.reset(LimitDimension.IP, "10.0.0.1"))
                .isInstanceOf(RateLimitStorageException.class);
    }

    @Test
    void statsShouldDescribeCacheAndPolicies() {
        service.checkIpRateLimit("10.0.0.10");
        service.checkIpRateLimit("10.0.0.10");

        LimiterStats stats = service.stats();

        assertThat(stats.getBackend()).isEqualTo("memory");
        assertThat(stats.getCachedLimiters()).isEqualTo(1);
        assertThat(stats.getCacheHits()).isEqualTo(1);
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getCacheHitRate()).isEqualTo(50.0);
        assertThat(stats.getTiers()).isEqualTo(4);
        assertThat(stats.isFailOpen()).isTrue();
    }

    @Test
    void clearLimiterCacheShouldKeepStoredQuota() {
        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isTrue();

        service.clearLimiterCache();

        assertThat(service.stats().getCachedLimiters()).isZero();
        assertThat(service.checkEndpointRateLimit("/api/bulk/import")).isFalse();
    }
}
