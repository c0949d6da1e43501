package com.aitrader.backend.service.lock;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

public final class RedisLockStore implements LockStore {

    private static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private static final RedisScript<Long> COMPARE_AND_EXPIRE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redis;

    public RedisLockStore(StringRedisTemplate redis) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
    }

    @Override
    public boolean setIfAbsent(String key, String token, Duration ttl) {
        Boolean ok = redis.opsForValue().setIfAbsent(key, token, ttl);
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public boolean compareAndDelete(String key, String token) {
        Long result = redis.execute(COMPARE_AND_DELETE, List.of(key), token);
        return result != null && result > 0;
    }

    @Override
    public boolean compareAndExpire(String key, String token, Duration ttl) {
        Long result = redis.execute(COMPARE_AND_EXPIRE, List.of(key), token, String.valueOf(ttl.toMillis()));
        return result != null && result > 0;
    }
}
