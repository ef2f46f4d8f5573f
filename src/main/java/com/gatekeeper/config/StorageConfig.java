package com.gatekeeper.config;

import com.gatekeeper.storage.InMemoryRateLimitStorage;
import com.gatekeeper.storage.JdbcRateLimitStorage;
import com.gatekeeper.storage.RateLimitStorage;
import com.gatekeeper.storage.RedisRateLimitStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

// exactly one backend is active, chosen by gatekeeper.storage.type
@Configuration
public class StorageConfig {

    private static final String PREFIX = "gatekeeper.storage";

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "memory", matchIfMissing = true)
    public RateLimitStorage inMemoryRateLimitStorage(GatekeeperProperties properties) {
        GatekeeperProperties.Memory memory = properties.getStorage().getMemory();
        return new InMemoryRateLimitStorage(memory.getMaxKeys(), memory.getIdleEviction());
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "jdbc")
    public RateLimitStorage jdbcRateLimitStorage(JdbcTemplate jdbcTemplate,
                                                 PlatformTransactionManager transactionManager) {
        return new JdbcRateLimitStorage(jdbcTemplate, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "redis")
    public RateLimitStorage redisRateLimitStorage(StringRedisTemplate redisTemplate,
                                                  GatekeeperProperties properties) {
        GatekeeperProperties.Redis redis = properties.getStorage().getRedis();
        return new RedisRateLimitStorage(redisTemplate, redis.getKeyPrefix(), redis.getMaxRetries(), redis.getKeyTtl());
    }
}
