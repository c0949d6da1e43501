package com.aitrader.backend.exception;

public class SymbolNotFoundException extends RuntimeException {
    public SymbolNotFoundException(String symbol) {
        super("Symbol " + symbol + " not found");
    }
}
