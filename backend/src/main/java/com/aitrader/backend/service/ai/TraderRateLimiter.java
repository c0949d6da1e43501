package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Per-trader cap on model calls within a fixed window. Never waits for a permit.
 */
@Component
public class TraderRateLimiter {

    private final RateLimiterRegistry registry;

    public TraderRateLimiter(ModelProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(properties.getRateLimit().getMaxRequests())
                .limitRefreshPeriod(Duration.ofSeconds(properties.getRateLimit().getWindowSeconds()))
                .timeoutDuration(Duration.ZERO)
                .build();
        this.registry = RateLimiterRegistry.of(config);
    }

    public boolean tryAcquire(Long traderId) {
        return registry.rateLimiter("trader-" + traderId).acquirePermission();
    }
}
