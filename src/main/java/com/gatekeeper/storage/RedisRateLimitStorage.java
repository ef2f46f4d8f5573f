package com.gatekeeper.storage;

import com.gatekeeper.model.BucketState;
import com.gatekeeper.model.CounterState;
import com.gatekeeper.model.WindowDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Redis storage shared by every instance of the service.
 *
 * <ul>
 *   <li>Buckets and counters are hashes, updated with WATCH/MULTI/EXEC and retried on conflict.</li>
 *   <li>Sliding windows are sorted sets scored by timestamp; prune, count and add run as one Lua script.</li>
 *   <li>Every key written gets a TTL, so abandoned keys disappear on their own.</li>
 * </ul>
 */
@Slf4j
public class RedisRateLimitStorage implements RateLimitStorage {

    private static final String TOKENS = "tokens";
    private static final String LAST_REFILL = "last_refill";
    private static final String WINDOW_START = "window_start";
    private static final String COUNTER = "counter";

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final int maxRetries;
    private final Duration keyTtl;
    private final RedisScript<List<Object>> slidingWindowScript;

    public RedisRateLimitStorage(StringRedisTemplate redisTemplate, String keyPrefix, int maxRetries, Duration keyTtl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.maxRetries = maxRetries;
        this.keyTtl = keyTtl;
        this.slidingWindowScript = loadScript("lua/sliding_window.lua");
        log.info("Initialized Redis rate limit storage: prefix={}, ttl={}", keyPrefix, keyTtl);
    }

    private static RedisScript<List<Object>> loadScript(String path) {
        try {
            ClassPathResource resource = new ClassPathResource(path);
            String scriptContent = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            @SuppressWarnings("unchecked")
            RedisScript<List<Object>> script = (RedisScript<List<Object>>) (RedisScript<?>)
                    RedisScript.of(scriptContent, List.class);
            return script;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load Redis script " + path, e);
        }
    }

    @Override
    public BucketState getBucketState(String key) {
        return guarded(key, () -> toBucket(redisTemplate.opsForHash().entries(bucketKey(key))));
    }

    @Override
    public void updateBucketState(String key, BucketState state) {
        String redisKey = bucketKey(key);
        guarded(key, () -> {
            redisTemplate.opsForHash().putAll(redisKey, fromBucket(state));
            return redisTemplate.expire(redisKey, keyTtl);
        });
    }

    @Override
    public BucketState updateBucket(String key, UnaryOperator<BucketState> transition) {
        return optimisticUpdate(bucketKey(key), hash -> transition.apply(toBucket(hash)), this::fromBucket);
    }

    @Override
    public long increment(String key, double timestamp) {
        return runWindowScript(key, timestamp, "-inf", Integer.MAX_VALUE, keyTtl.getSeconds()).getCount();
    }

    @Override
    public void prune(String key, double cutoff) {
        guarded(key, () -> redisTemplate.opsForZSet().removeRangeByScore(windowKey(key), Double.NEGATIVE_INFINITY, cutoff));
    }

    @Override
    public long count(String key) {
        Long size = guarded(key, () -> redisTemplate.opsForZSet().zCard(windowKey(key)));
        return size != null ? size : 0L;
    }

    @Override
    public OptionalDouble oldestTimestamp(String key) {
        Set<ZSetOperations.TypedTuple<String>> first =
                guarded(key, () -> redisTemplate.opsForZSet().rangeWithScores(windowKey(key), 0, 0));
        if (first == null || first.isEmpty()) {
            return OptionalDouble.empty();
        }
        Double score = first.iterator().next().getScore();
        return score != null ? OptionalDouble.of(score) : OptionalDouble.empty();
    }

    @Override
    public WindowDecision slide(String key, double timestamp, double cutoff, int maxRequests) {
        long windowSeconds = (long) Math.ceil(timestamp - cutoff);
        long ttl = Math.max(keyTtl.getSeconds(), windowSeconds + 60);
        return runWindowScript(key, timestamp, Double.toString(cutoff), maxRequests, ttl);
    }

    @Override
    public CounterState getCounterState(String key) {
        return guarded(key, () -> toCounter(redisTemplate.opsForHash().entries(counterKey(key))));
    }

    @Override
    public void updateCounterState(String key, CounterState state) {
        String redisKey = counterKey(key);
        guarded(key, () -> {
            redisTemplate.opsForHash().putAll(redisKey, fromCounter(state));
            return redisTemplate.expire(redisKey, keyTtl);
        });
    }

    @Override
    public CounterState updateCounter(String key, UnaryOperator<CounterState> transition) {
        return optimisticUpdate(counterKey(key), hash -> transition.apply(toCounter(hash)), this::fromCounter);
    }

    @Override
    public void reset(String key) {
        Long deleted = guarded(key, () -> redisTemplate.delete(List.of(bucketKey(key), windowKey(key), counterKey(key))));
        log.debug("Reset {}: {} Redis keys deleted", key, deleted);
    }

    @Override
    public void ping() {
        guarded("ping", () -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
    }

    @Override
    public String backendName() {
        return "redis";
    }

    private WindowDecision runWindowScript(String key, double timestamp, String cutoff, int maxRequests, long ttlSeconds) {
        List<Object> result = guarded(key, () -> redisTemplate.execute(
                slidingWindowScript,
                Collections.singletonList(windowKey(key)),
                Double.toString(timestamp),
                cutoff,
                Integer.toString(maxRequests),
                Double.toString(timestamp) + ":" + UUID.randomUUID(),
                Long.toString(ttlSeconds)));

        if (result == null || result.size() < 2) {
            throw new RateLimitStorageException("Invalid response from Redis sliding window script for key: " + key);
        }
        boolean allowed = ((Number) result.get(0)).intValue() == 1;
        long count = ((Number) result.get(1)).longValue();
        return new WindowDecision(allowed, count);
    }

    // WATCH the hash, compute the next state, write it in MULTI; retry when EXEC is aborted
    private <S> S optimisticUpdate(String redisKey, Function<Map<Object, Object>, S> transition,
                                   Function<S, Map<String, String>> encoder) {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            AtomicReference<S> next = new AtomicReference<>();
            List<Object> exec = guarded(redisKey, () -> redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(redisKey);
                    S state = transition.apply(ops.opsForHash().entries(redisKey));
                    next.set(state);
                    ops.multi();
                    ops.opsForHash().putAll(redisKey, encoder.apply(state));
                    ops.expire(redisKey, keyTtl);
                    return ops.exec();
                }
            }));
            if (exec != null && !exec.isEmpty()) {
                return next.get();
            }
            log.debug("Optimistic update of {} aborted by a concurrent writer (attempt {})", redisKey, attempt);
        }
        throw new RateLimitStorageException(
                "Gave up updating " + redisKey + " after " + maxRetries + " conflicting attempts");
    }

    private <T> T guarded(String key, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new RateLimitStorageException("Redis rate limit storage failed for key: " + key, e);
        }
    }

    private BucketState toBucket(Map<Object, Object> hash) {
        if (hash == null || hash.isEmpty()) {
            return null;
        }
        return new BucketState(
                Double.parseDouble((String) hash.get(TOKENS)),
                Double.parseDouble((String) hash.get(LAST_REFILL)));
    }

    private Map<String, String> fromBucket(BucketState state) {
        return Map.of(
                TOKENS, Double.toString(state.getTokens()),
                LAST_REFILL, Double.toString(state.getLastRefill()));
    }

    private CounterState toCounter(Map<Object, Object> hash) {
        if (hash == null || hash.isEmpty()) {
            return null;
        }
        return new CounterState(
                Long.parseLong((String) hash.get(WINDOW_START)),
                Long.parseLong((String) hash.get(COUNTER)));
    }

    private Map<String, String> fromCounter(CounterState state) {
        return Map.of(
                WINDOW_START, Long.toString(state.getWindowStart()),
                COUNTER, Long.toString(state.getCounter()));
    }

    private String bucketKey(String key) {
        return keyPrefix + "bucket:" + key;
    }

    private String windowKey(String key) {
        return keyPrefix + "window:" + key;
    }

    private String counterKey(String key) {
        return keyPrefix + "counter:" + key;
    }
}
