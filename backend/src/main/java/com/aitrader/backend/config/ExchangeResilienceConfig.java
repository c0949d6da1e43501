package com.aitrader.backend.config;

import com.aitrader.backend.exception.ExchangeApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience for exchange reads. Order placement never goes through these.
 */
@Configuration
public class ExchangeResilienceConfig {

    @Bean
    public CircuitBreakerRegistry exchangeCircuitBreakers(
            @Value("${exchange.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${exchange.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${exchange.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .recordException(ExchangeResilienceConfig::isTransient)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public Retry exchangeReadRetry(
            @Value("${exchange.retry.max-attempts:3}") int maxAttempts,
            @Value("${exchange.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${exchange.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryOnException(ExchangeResilienceConfig::isTransient)
                .build();
        return Retry.of("exchange-read", config);
    }

    /**
     * Transport failures, throttling and server errors.
     */
    static boolean isTransient(Throwable t) {
        if (!(t instanceof ExchangeApiException)) {
            return false;
        }
        int status = ((ExchangeApiException) t).getStatusCode();
        return status < 0 || status == 429 || status >= 500;
    }
}
