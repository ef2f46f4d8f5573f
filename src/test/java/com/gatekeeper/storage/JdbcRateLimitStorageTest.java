package com.gatekeeper.storage;

import com.gatekeeper.model.BucketState;
import com.gatekeeper.model.CounterState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRateLimitStorageTest extends AbstractRateLimitStorageTest {

    @TempDir
    Path tempDir;

    private JdbcRateLimitStorage storage;

    @BeforeEach
    void setUp() {
        storage = open();
    }

    @Override
    protected RateLimitStorage storage() {
        return storage;
    }

    private JdbcRateLimitStorage open() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:file:" + tempDir.resolve("gatekeeper").toAbsolutePath(), "sa", "");
        return new JdbcRateLimitStorage(new JdbcTemplate(dataSource), new DataSourceTransactionManager(dataSource));
    }

    @Test
    void shouldKeepStateAcrossReopen() {
        storage.updateBucketState("ip:10.0.0.1", new BucketState(0.5, 1_000));
        storage.updateCounterState("endpoint:/api/bulk/export", new CounterState(100, 1));
        storage.increment("endpoint:/api/auth/login", 1_000);

        JdbcRateLimitStorage reopened = open();

        assertThat(reopened.getBucketState("ip:10.0.0.1")).isEqualTo(new BucketState(0.5, 1_000));
        assertThat(reopened.getCounterState("endpoint:/api/bulk/export")).isEqualTo(new CounterState(100, 1));
        assertThat(reopened.count("endpoint:/api/auth/login")).isEqualTo(1);
    }

    @Test
    void shouldWrapDatabaseFailures() {
        DriverManagerDataSource broken = new DriverManagerDataSource(
                "jdbc:h2:file:" + tempDir.resolve("broken").toAbsolutePath(), "sa", "");
        JdbcRateLimitStorage brokenStorage = new JdbcRateLimitStorage(new JdbcTemplate(broken),
                new DataSourceTransactionManager(broken));
        new JdbcTemplate(broken).execute("DROP TABLE rate_limit_bucket");

        assertThatThrownBy(() -> brokenStorage.getBucketState("k"))
                .isInstanceOf(RateLimitStorageException.class)
                .hasMessageContaining("k");
    }

    @Test
    void shouldReportJdbcBackend() {
        assertThat(storage.backendName()).isEqualTo("jdbc");
    }
}
