package com.aitrader.backend.config;

import com.aitrader.backend.service.lock.InMemoryLockStore;
import com.aitrader.backend.service.lock.LockStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single-process locking, for local runs and tests.
 */
@Configuration
@ConditionalOnProperty(name = "lock.store", havingValue = "memory")
public class InMemoryLockConfig {

    @Bean
    public LockStore lockStore(Clock clock) {
        return new InMemoryLockStore(clock);
    }
}
