package com.aitrader.backend.exception;

/**
 * Configuration error: the model config references a provider with no adapter.
 */
public class UnsupportedModelProviderException extends RuntimeException {
    public UnsupportedModelProviderException(String provider) {
        super("Unknown provider: " + provider);
    }
}
