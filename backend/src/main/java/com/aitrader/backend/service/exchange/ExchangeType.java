package com.aitrader.backend.service.exchange;

import com.aitrader.backend.exception.UnsupportedExchangeException;

import java.util.Locale;

public enum ExchangeType {
    BINANCE("binance"),
    GATE("gate");

    private final String id;

    ExchangeType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static ExchangeType fromString(String exchange) {
        if (exchange != null) {
            String normalized = exchange.trim().toLowerCase(Locale.ROOT);
            for (ExchangeType candidate : values()) {
                if (candidate.id.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new UnsupportedExchangeException(exchange);
    }
}
