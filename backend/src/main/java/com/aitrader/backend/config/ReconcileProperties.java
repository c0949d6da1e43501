package com.aitrader.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "reconcile")
@Data
@Validated
public class ReconcileProperties {

    private boolean enabled = true;

    @Min(1)
    private long intervalSeconds = 300;

    @Min(1)
    private int lookbackHours = 24;

    @Min(1)
    private int batchSize = 100;
}
