package com.aitrader.backend.config;

import com.aitrader.backend.service.lock.LockStore;
import com.aitrader.backend.service.lock.RedisLockStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Connection settings come from {@code spring.data.redis.*}.
 */
@Configuration
@ConditionalOnProperty(name = "lock.store", havingValue = "redis", matchIfMissing = true)
public class RedisLockConfig {

    @Bean
    public LockStore lockStore(StringRedisTemplate stringRedisTemplate) {
        return new RedisLockStore(stringRedisTemplate);
    }
}
