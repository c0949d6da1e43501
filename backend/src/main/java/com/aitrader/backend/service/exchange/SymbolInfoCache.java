package com.aitrader.backend.service.exchange;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide symbol precision cache shared by short-lived adapter instances.
 */
@Component
public class SymbolInfoCache {

    private final ConcurrentHashMap<String, SymbolInfo> cache = new ConcurrentHashMap<>();

    public Optional<SymbolInfo> get(ExchangeType exchange, boolean testnet, String symbol) {
        return Optional.ofNullable(cache.get(key(exchange, testnet, symbol)));
    }

    public void put(ExchangeType exchange, boolean testnet, String symbol, SymbolInfo info) {
        cache.put(key(exchange, testnet, symbol), info);
    }

    public void clear() {
        cache.clear();
    }

    private String key(ExchangeType exchange, boolean testnet, String symbol) {
        return exchange.getId() + (testnet ? ":testnet:" : ":live:") + symbol;
    }
}
