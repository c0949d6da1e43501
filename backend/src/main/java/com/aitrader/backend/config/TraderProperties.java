package com.aitrader.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "trader")
@Data
@Validated
public class TraderProperties {

    // Forces every trader into paper mode regardless of its own setting
    private boolean paperTrading = true;

    @Min(1)
    private int signalBatchSize = 5;

    @Min(1)
    private int recentTradesHours = 24;

    @Min(1)
    private int snapshotOhlcvPoints = 10;

    // Sends the trade plan JSON Schema to providers that support structured output
    private boolean structuredOutput = false;

    @Positive
    private BigDecimal paperFillPrice = new BigDecimal("50000");

    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Valid
    private RiskDefaults defaultRisk = new RiskDefaults();

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;

        @Min(1)
        private long intervalSeconds = 60;
    }

    @Data
    public static class RiskDefaults {
        @Min(1)
        @Max(125)
        private int maxLeverage = 10;

        @Min(1)
        private int maxConcurrentPositions = 5;

        @Min(0)
        private int cooldownSeconds = 3600;

        @Min(0)
        private int pricePrecision = 2;

        @Min(0)
        private int quantityPrecision = 3;

        @DecimalMin("0")
        private BigDecimal minQuantity = new BigDecimal("0.001");

        @DecimalMin("0")
        private BigDecimal minNotional = new BigDecimal("5");
    }
}
