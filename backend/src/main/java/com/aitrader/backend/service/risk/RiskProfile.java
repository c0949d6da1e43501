package com.aitrader.backend.service.risk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Limits applied to one cycle. Null caps are not enforced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfile {

    @Builder.Default
    private int maxLeverage = 10;

    private BigDecimal maxPositionNotional;

    private BigDecimal maxPositionQty;

    @Builder.Default
    private int maxConcurrentPositions = 5;

    @Builder.Default
    private long cooldownSeconds = 3600;

    private BigDecimal dailyLossCap;

    @Builder.Default
    private int pricePrecision = 2;

    @Builder.Default
    private int quantityPrecision = 3;

    @Builder.Default
    private BigDecimal minQuantity = new BigDecimal("0.001");

    @Builder.Default
    private BigDecimal minNotional = new BigDecimal("5");

    /**
     * The subset shown to the model.
     */
    public Map<String, Object> toPromptData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("max_leverage", maxLeverage);
        data.put("max_position_notional", maxPositionNotional == null ? null : maxPositionNotional.toPlainString());
        data.put("max_concurrent_positions", maxConcurrentPositions);
        data.put("cooldown_seconds", cooldownSeconds);
        return data;
    }
}
