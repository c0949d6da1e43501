package com.aitrader.backend.service.lock;

import java.time.Duration;

/**
 * Atomic key-value operations a mutex needs. Every call is a single atomic step on the store.
 */
public interface LockStore {

    boolean setIfAbsent(String key, String token, Duration ttl);

    /**
     * Deletes the key only while it still holds {@code token}.
     */
    boolean compareAndDelete(String key, String token);

    /**
     * Resets the expiry only while the key still holds {@code token}.
     */
    boolean compareAndExpire(String key, String token, Duration ttl);
}
