package com.aitrader.backend.service.exchange;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Uniform order outcome. Placement never throws for HTTP or transport failures;
 * those come back with {@code success=false} and the exchange error preserved.
 */
public record OrderResult(
        boolean success,
        String orderId,
        String clientOrderId,
        OrderStatus status,
        BigDecimal filledQty,
        BigDecimal filledPrice,
        String errorCode,
        String errorMessage,
        JsonNode raw
) {

    public static OrderResult failure(String errorCode, String errorMessage) {
        return new OrderResult(false, null, null, null, null, null, errorCode, errorMessage, null);
    }

    public boolean isFilled() {
        return success && status == OrderStatus.FILLED;
    }
}
