package com.aitrader.backend.service.exchange;

import com.aitrader.backend.config.ExchangeProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Shared collaborators handed to every adapter instance.
 */
@Component
@Getter
@RequiredArgsConstructor
public class ExchangeClientSupport {

    private final ExchangeProperties properties;
    private final ObjectMapper objectMapper;
    private final Retry exchangeReadRetry;
    private final CircuitBreakerRegistry exchangeCircuitBreakers;
    private final SymbolInfoCache symbolInfoCache;
    private final Clock clock;
}
