package com.gatekeeper.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class InMemoryRateLimitStorageTest extends AbstractRateLimitStorageTest {

    private InMemoryRateLimitStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryRateLimitStorage();
    }

    @Override
    protected RateLimitStorage storage() {
        return storage;
    }

    @Test
    void shouldEvictIdleKeys() {
        InMemoryRateLimitStorage shortLived = new InMemoryRateLimitStorage(100, Duration.ofMillis(200));
        shortLived.increment("idle", 1);

        // every read counts as an access, so poll less often than the idle timeout
        await().atMost(Duration.ofSeconds(3))
                .pollDelay(Duration.ofMillis(400))
                .pollInterval(Duration.ofMillis(400))
                .untilAsserted(() -> assertThat(shortLived.count("idle")).isZero());
    }

    @Test
    void shouldReportMemoryBackend() {
        assertThat(storage.backendName()).isEqualTo("memory");
    }
}
