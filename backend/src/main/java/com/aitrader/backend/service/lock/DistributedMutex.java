package com.aitrader.backend.service.lock;

import java.time.Duration;

/**
 * Named, TTL-bounded mutex shared across worker processes. Failing to acquire is a normal
 * outcome, not an error. Closing releases the mutex if held.
 */
public interface DistributedMutex extends AutoCloseable {

    String name();

    /**
     * Single attempt.
     */
    boolean tryAcquire();

    /**
     * Polls until acquired or the timeout elapses.
     */
    boolean acquireBlocking(Duration timeout);

    /**
     * Releases only if this instance still owns the lock.
     */
    boolean release();

    boolean extend(Duration ttl);

    boolean isHeld();

    @Override
    void close();
}
