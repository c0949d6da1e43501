package com.aitrader.backend.exception;

/**
 * Configuration error: the account references an exchange with no adapter.
 */
public class UnsupportedExchangeException extends RuntimeException {
    public UnsupportedExchangeException(String exchange) {
        super("Unknown exchange: " + exchange);
    }
}
