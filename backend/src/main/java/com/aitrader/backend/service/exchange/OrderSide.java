package com.aitrader.backend.service.exchange;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Entry side for a plan side ("long" buys, "short" sells).
     */
    public static OrderSide forPositionSide(String side) {
        return "long".equalsIgnoreCase(side) ? BUY : SELL;
    }
}
