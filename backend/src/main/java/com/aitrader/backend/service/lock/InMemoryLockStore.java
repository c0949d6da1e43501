package com.aitrader.backend.service.lock;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-JVM lock store for local runs and tests.
 */
public final class InMemoryLockStore implements LockStore {

    private record Entry(String token, long expiresAtMillis) {
        boolean isExpired(long now) {
            return now >= expiresAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLockStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean setIfAbsent(String key, String token, Duration ttl) {
        long now = clock.millis();
        Entry fresh = new Entry(token, now + ttl.toMillis());
        Entry result = entries.compute(key, (k, existing) ->
                existing == null || existing.isExpired(now) ? fresh : existing);
        return result == fresh;
    }

    @Override
    public boolean compareAndDelete(String key, String token) {
        long now = clock.millis();
        boolean[] deleted = {false};
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (existing.token().equals(token)) {
                deleted[0] = true;
                return null;
            }
            return existing;
        });
        return deleted[0];
    }

    @Override
    public boolean compareAndExpire(String key, String token, Duration ttl) {
        long now = clock.millis();
        boolean[] extended = {false};
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (existing.token().equals(token)) {
                extended[0] = true;
                return new Entry(token, now + ttl.toMillis());
            }
            return existing;
        });
        return extended[0];
    }
}
