package com.aitrader.backend.service.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;

@Slf4j
public class StoreBackedMutex implements DistributedMutex {

    static final String KEY_PREFIX = "lock:";

    private final LockStore store;
    private final String name;
    private final String key;
    private final String token = UUID.randomUUID().toString();
    private final Duration ttl;
    private final Duration pollInterval;
    private volatile boolean held;

    public StoreBackedMutex(LockStore store, String name, Duration ttl, Duration pollInterval) {
        this.store = store;
        this.name = name;
        this.key = KEY_PREFIX + name;
        this.ttl = ttl;
        this.pollInterval = pollInterval;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        if (store.setIfAbsent(key, token, ttl)) {
            held = true;
            log.debug("Lock acquired: {}", key);
            return true;
        }
        return false;
    }

    @Override
    public boolean acquireBlocking(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (tryAcquire()) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    @Override
    public boolean release() {
        if (!held) {
            return false;
        }
        held = false;
        boolean released = store.compareAndDelete(key, token);
        if (released) {
            log.debug("Lock released: {}", key);
        } else {
            log.info("Lock {} had already expired before release", key);
        }
        return released;
    }

    @Override
    public boolean extend(Duration newTtl) {
        return held && store.compareAndExpire(key, token, newTtl);
    }

    @Override
    public boolean isHeld() {
        return held;
    }

    @Override
    public void close() {
        release();
    }
}
