package com.aitrader.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "model")
@Data
@Validated
public class ModelProperties {

    @Min(1)
    private long timeoutSeconds = 60;

    @Min(1)
    private int maxTokens = 4096;

    private double temperature = 0.1;

    @Valid
    private RetryProperties retry = new RetryProperties();

    @Valid
    private RateLimitProperties rateLimit = new RateLimitProperties();

    @Valid
    private Endpoints endpoints = new Endpoints();

    @Data
    public static class RetryProperties {
        @Min(1)
        private int maxAttempts = 3;

        // One backoff "second"; tests shrink it
        @Min(1)
        private long backoffUnitMillis = 1000;
    }

    @Data
    public static class RateLimitProperties {
        @Min(1)
        private int maxRequests = 10;

        @Min(1)
        private long windowSeconds = 60;
    }

    @Data
    public static class Endpoints {
        @NotBlank
        private String openai = "https://api.openai.com/v1";

        @NotBlank
        private String anthropic = "https://api.anthropic.com/v1";

        @NotBlank
        private String google = "https://generativelanguage.googleapis.com/v1beta";
    }
}
