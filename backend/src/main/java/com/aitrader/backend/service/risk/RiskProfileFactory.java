package com.aitrader.backend.service.risk;

import com.aitrader.backend.config.TraderProperties;
import com.aitrader.backend.model.Strategy;
import com.aitrader.backend.model.Trader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Builds the per-cycle risk profile: strategy {@code risk_json} over configured defaults, plus
 * the trader's concurrency cap and daily loss cap and the strategy cooldown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RiskProfileFactory {

    private final TraderProperties traderProperties;
    private final ObjectMapper objectMapper;

    public RiskProfile build(Trader trader, Strategy strategy) {
        TraderProperties.RiskDefaults defaults = traderProperties.getDefaultRisk();
        JsonNode risk = parse(strategy);

        return RiskProfile.builder()
                .maxLeverage(risk.path("max_leverage").asInt(defaults.getMaxLeverage()))
                .maxPositionNotional(positiveDecimal(risk, "max_position_notional", null))
                .maxPositionQty(positiveDecimal(risk, "max_position_qty", null))
                .maxConcurrentPositions(trader.getMaxConcurrentPositions() != null
                        ? trader.getMaxConcurrentPositions() : defaults.getMaxConcurrentPositions())
                .cooldownSeconds(strategy != null && strategy.getCooldownSeconds() != null
                        ? strategy.getCooldownSeconds() : defaults.getCooldownSeconds())
                .dailyLossCap(trader.getDailyLossCap())
                .pricePrecision(risk.path("price_precision").asInt(defaults.getPricePrecision()))
                .quantityPrecision(risk.path("quantity_precision").asInt(defaults.getQuantityPrecision()))
                .minQuantity(positiveDecimal(risk, "min_quantity", defaults.getMinQuantity()))
                .minNotional(positiveDecimal(risk, "min_notional", defaults.getMinNotional()))
                .build();
    }

    private JsonNode parse(Strategy strategy) {
        if (strategy == null || strategy.getRiskJson() == null || strategy.getRiskJson().isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(strategy.getRiskJson());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed risk_json on strategy {}: {}", strategy.getId(), e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static BigDecimal positiveDecimal(JsonNode risk, String field, BigDecimal fallback) {
        JsonNode value = risk.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        try {
            BigDecimal decimal = new BigDecimal(value.asText());
            return decimal.signum() > 0 ? decimal : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
