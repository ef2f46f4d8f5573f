package com.gatekeeper.storage;

import com.gatekeeper.model.BucketState;
import com.gatekeeper.model.CounterState;
import com.gatekeeper.model.WindowDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Durable storage in an embedded database (H2 in file mode by default) so that limits
 * survive a restart. All writes go through one writer lock and run inside a
 * transaction; reads are not locked.
 */
@Slf4j
public class JdbcRateLimitStorage implements RateLimitStorage {

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS rate_limit_bucket ("
                    + " state_key VARCHAR(512) PRIMARY KEY,"
                    + " tokens DOUBLE PRECISION NOT NULL,"
                    + " last_refill DOUBLE PRECISION NOT NULL)",
            "CREATE TABLE IF NOT EXISTS rate_limit_window ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " state_key VARCHAR(512) NOT NULL,"
                    + " ts DOUBLE PRECISION NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_rate_limit_window_key ON rate_limit_window (state_key, ts)",
            "CREATE TABLE IF NOT EXISTS rate_limit_counter ("
                    + " state_key VARCHAR(512) PRIMARY KEY,"
                    + " window_start BIGINT NOT NULL,"
                    + " request_count BIGINT NOT NULL)"
    };

    private static final RowMapper<BucketState> BUCKET_MAPPER =
            (rs, rowNum) -> new BucketState(rs.getDouble("tokens"), rs.getDouble("last_refill"));
    private static final RowMapper<CounterState> COUNTER_MAPPER =
            (rs, rowNum) -> new CounterState(rs.getLong("window_start"), rs.getLong("request_count"));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcRateLimitStorage(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        initializeSchema();
    }

    private void initializeSchema() {
        guarded("schema", () -> {
            for (String statement : SCHEMA) {
                jdbcTemplate.execute(statement);
            }
            return null;
        });
        log.info("JDBC rate limit storage schema ready");
    }

    @Override
    public BucketState getBucketState(String key) {
        return guarded(key, () -> selectBucket(key));
    }

    @Override
    public void updateBucketState(String key, BucketState state) {
        write(key, () -> {
            mergeBucket(key, state);
            return null;
        });
    }

    @Override
    public BucketState updateBucket(String key, UnaryOperator<BucketState> transition) {
        return write(key, () -> {
            BucketState next = transition.apply(selectBucket(key));
            mergeBucket(key, next);
            return next;
        });
    }

    @Override
    public long increment(String key, double timestamp) {
        return write(key, () -> {
            insertTimestamp(key, timestamp);
            return countTimestamps(key);
        });
    }

    @Override
    public void prune(String key, double cutoff) {
        write(key, () -> jdbcTemplate.update(
                "DELETE FROM rate_limit_window WHERE state_key = ? AND ts <= ?", key, cutoff));
    }

    @Override
    public long count(String key) {
        return guarded(key, () -> countTimestamps(key));
    }

    @Override
    public OptionalDouble oldestTimestamp(String key) {
        return guarded(key, () -> {
            Double oldest = jdbcTemplate.queryForObject(
                    "SELECT MIN(ts) FROM rate_limit_window WHERE state_key = ?", Double.class, key);
            return oldest != null ? OptionalDouble.of(oldest) : OptionalDouble.empty();
        });
    }

    @Override
    public WindowDecision slide(String key, double timestamp, double cutoff, int maxRequests) {
        return write(key, () -> {
            jdbcTemplate.update("DELETE FROM rate_limit_window WHERE state_key = ? AND ts <= ?", key, cutoff);
            long count = countTimestamps(key);
            if (count >= maxRequests) {
                return new WindowDecision(false, count);
            }
            insertTimestamp(key, timestamp);
            return new WindowDecision(true, count + 1);
        });
    }

    @Override
    public CounterState getCounterState(String key) {
        return guarded(key, () -> selectCounter(key));
    }

    @Override
    public void updateCounterState(String key, CounterState state) {
        write(key, () -> {
            mergeCounter(key, state);
            return null;
        });
    }

    @Override
    public CounterState updateCounter(String key, UnaryOperator<CounterState> transition) {
        return write(key, () -> {
            CounterState next = transition.apply(selectCounter(key));
            mergeCounter(key, next);
            return next;
        });
    }

    @Override
    public void reset(String key) {
        write(key, () -> {
            jdbcTemplate.update("DELETE FROM rate_limit_bucket WHERE state_key = ?", key);
            jdbcTemplate.update("DELETE FROM rate_limit_window WHERE state_key = ?", key);
            return jdbcTemplate.update("DELETE FROM rate_limit_counter WHERE state_key = ?", key);
        });
    }

    @Override
    public void ping() {
        guarded("ping", () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }

    @Override
    public String backendName() {
        return "jdbc";
    }

    private BucketState selectBucket(String key) {
        List<BucketState> rows = jdbcTemplate.query(
                "SELECT tokens, last_refill FROM rate_limit_bucket WHERE state_key = ?", BUCKET_MAPPER, key);
        return rows.isEmpty() ? null : rows.get(0);
    }

    private void mergeBucket(String key, BucketState state) {
        jdbcTemplate.update(
                "MERGE INTO rate_limit_bucket (state_key, tokens, last_refill) KEY (state_key) VALUES (?, ?, ?)",
                key, state.getTokens(), state.getLastRefill());
    }

    private CounterState selectCounter(String key) {
        List<CounterState> rows = jdbcTemplate.query(
                "SELECT window_start, request_count FROM rate_limit_counter WHERE state_key = ?",
                COUNTER_MAPPER, key);
        return rows.isEmpty() ? null : rows.get(0);
    }

    private void mergeCounter(String key, CounterState state) {
        jdbcTemplate.update(
                "MERGE INTO rate_limit_counter (state_key, window_start, request_count) KEY (state_key) VALUES (?, ?, ?)",
                key, state.getWindowStart(), state.getCounter());
    }

    private void insertTimestamp(String key, double timestamp) {
        jdbcTemplate.update("INSERT INTO rate_limit_window (state_key, ts) VALUES (?, ?)", key, timestamp);
    }

    private long countTimestamps(String key) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM rate_limit_window WHERE state_key = ?", Long.class, key);
        return count != null ? count : 0L;
    }

    // single writer, one transaction per compound step
    private <T> T write(String key, Supplier<T> work) {
        writeLock.lock();
        try {
            return guarded(key, () -> transactionTemplate.execute(status -> work.get()));
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T guarded(String key, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            throw new RateLimitStorageException("JDBC rate limit storage failed for key: " + key, e);
        }
    }
}
