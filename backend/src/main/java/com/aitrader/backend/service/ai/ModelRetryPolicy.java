package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded retry for model calls. Failed responses are retried unless the error is
 * {@link ModelErrorType#AUTH} or {@link ModelErrorType#QUOTA}; exhaustion returns the last
 * failed response. Waits before attempt n+1 are {@code (2^(n-1) + 0.1*(n-1))} backoff units.
 */
@Component
@Slf4j
public class ModelRetryPolicy {

    private final Retry retry;

    public ModelRetryPolicy(ModelProperties properties) {
        long unitMillis = properties.getRetry().getBackoffUnitMillis();
        IntervalFunction backoff = attempt ->
                Math.round((Math.pow(2, attempt - 1) + 0.1 * (attempt - 1)) * unitMillis);
        RetryConfig config = RetryConfig.<ModelResponse>custom()
                .maxAttempts(properties.getRetry().getMaxAttempts())
                .intervalFunction(backoff)
                .retryOnResult(response -> !response.success() && response.errorType().isRetryable())
                .build();
        this.retry = Retry.of("model-generate", config);
    }

    public ModelResponse generateWithRetry(ModelAdapter adapter, String systemPrompt, String userPrompt,
                                           JsonNode jsonSchema) {
        Supplier<ModelResponse> attempt = () -> {
            try {
                ModelResponse response = adapter.generate(systemPrompt, userPrompt, jsonSchema);
                if (!response.success()) {
                    log.debug("{} attempt failed type={}", adapter.provider().getId(), response.errorType());
                }
                return response;
            } catch (RuntimeException e) {
                String message = String.valueOf(e.getMessage());
                return ModelResponse.failure(ModelErrorType.NETWORK,
                        message.length() > 200 ? message.substring(0, 200) : message);
            }
        };
        return Retry.decorateSupplier(retry, attempt).get();
    }
}
