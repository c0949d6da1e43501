package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import com.aitrader.backend.exception.SecretsException;
import com.aitrader.backend.model.ModelConfig;
import com.aitrader.backend.service.MetricsService;
import com.aitrader.backend.service.secrets.SecretsCrypto;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for model calls: rate limit, adapter selection, retry. A fresh adapter is
 * built per call and closed before returning.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelRouter {

    private final ModelProperties properties;
    private final ObjectMapper objectMapper;
    private final SecretsCrypto secretsCrypto;
    private final ModelRetryPolicy retryPolicy;
    private final TraderRateLimiter rateLimiter;
    private final MetricsService metricsService;

    /**
     * @throws com.aitrader.backend.exception.UnsupportedModelProviderException for an unknown provider
     */
    public ModelResponse generate(ModelConfig config, Long traderId, String systemPrompt, String userPrompt,
                                  JsonNode jsonSchema) {
        ModelProvider provider = ModelProvider.fromString(config.getProvider());
        if (traderId != null && !rateLimiter.tryAcquire(traderId)) {
            log.info("Model rate limit reached trader={}", traderId);
            metricsService.recordModelCall(provider.getId(), "rate_limited");
            return ModelResponse.failure(ModelErrorType.RATE_LIMIT, "Trader rate limit exceeded");
        }

        String apiKey;
        try {
            apiKey = secretsCrypto.decrypt(config.getApiKeyEncrypted());
        } catch (SecretsException e) {
            log.error("Cannot decrypt API key for model config {}: {}", config.getId(), e.getMessage());
            metricsService.recordModelCall(provider.getId(), "failed");
            return ModelResponse.failure(ModelErrorType.AUTH, "Could not decrypt model API key");
        }

        try (ModelAdapter adapter = createAdapter(provider, apiKey, config.getModelName(), config.getBaseUrl())) {
            ModelResponse response = retryPolicy.generateWithRetry(adapter, systemPrompt, userPrompt, jsonSchema);
            metricsService.recordModelCall(provider.getId(), response.success() ? "success" : "failed");
            return response;
        }
    }

    ModelAdapter createAdapter(ModelProvider provider, String apiKey, String modelName, String baseUrlOverride) {
        return switch (provider) {
            case OPENAI -> new OpenAiAdapter(apiKey, modelName,
                    baseUrl(baseUrlOverride, properties.getEndpoints().getOpenai()), properties, objectMapper);
            case ANTHROPIC -> new AnthropicAdapter(apiKey, modelName,
                    baseUrl(baseUrlOverride, properties.getEndpoints().getAnthropic()), properties, objectMapper);
            case GOOGLE -> new GoogleAdapter(apiKey, modelName,
                    baseUrl(baseUrlOverride, properties.getEndpoints().getGoogle()), properties, objectMapper);
        };
    }

    private static String baseUrl(String override, String fallback) {
        return override != null && !override.isBlank() ? override : fallback;
    }
}
