package com.aitrader.backend.service.lock;

import com.aitrader.backend.config.LockProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Names and TTLs for the mutexes the workers take.
 */
@Component
@RequiredArgsConstructor
public class MutexFactory {

    private final LockStore lockStore;
    private final LockProperties properties;

    public DistributedMutex traderCycle(Long traderId) {
        return create("trader:" + traderId + ":cycle", traderCycleTtl());
    }

    public Duration traderCycleTtl() {
        return Duration.ofSeconds(properties.getTraderCycleTtlSeconds());
    }

    public DistributedMutex reconcile(Long exchangeAccountId) {
        return create("reconcile:" + exchangeAccountId, Duration.ofSeconds(properties.getReconcileTtlSeconds()));
    }

    public Duration blockingTimeout() {
        return Duration.ofSeconds(properties.getBlockingTimeoutSeconds());
    }

    private DistributedMutex create(String name, Duration ttl) {
        return new StoreBackedMutex(lockStore, name, ttl, Duration.ofMillis(properties.getPollIntervalMillis()));
    }
}
