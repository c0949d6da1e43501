package com.aitrader.backend.service.exchange;

import java.math.BigDecimal;

/**
 * @param side LONG or SHORT
 * @param marginType CROSS or ISOLATED
 */
public record PositionInfo(
        String symbol,
        String side,
        BigDecimal quantity,
        BigDecimal entryPrice,
        BigDecimal unrealizedPnl,
        int leverage,
        String marginType
) {
}
