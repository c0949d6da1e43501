package com.aitrader.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "lock")
@Data
@Validated
public class LockProperties {

    // redis | memory
    private String store = "redis";

    @Min(0)
    private long blockingTimeoutSeconds = 5;

    @Min(1)
    private long pollIntervalMillis = 100;

    // re-extended before every signal
    @Min(1)
    private long traderCycleTtlSeconds = 300;

    @Min(1)
    private long reconcileTtlSeconds = 300;
}
