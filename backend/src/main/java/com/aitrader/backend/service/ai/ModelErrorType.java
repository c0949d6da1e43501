package com.aitrader.backend.service.ai;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ModelErrorType {
    AUTH,
    QUOTA,
    RATE_LIMIT,
    INVALID_OUTPUT,
    TIMEOUT,
    NETWORK,
    UNKNOWN;

    /**
     * Retrying cannot fix bad or exhausted credentials.
     */
    public boolean isRetryable() {
        return this != AUTH && this != QUOTA;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
