package com.aitrader.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ExecutionStatus {
    PENDING("pending"),
    SUBMITTED("submitted"),
    FILLED("filled"),
    PARTIALLY_FILLED("partially_filled"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == FAILED;
    }

    public boolean isClosed() {
        return this == FILLED || this == CANCELLED;
    }

    /**
     * Maps an exchange status word to a local status. Words that imply no change
     * (new, open) yield empty.
     */
    public static Optional<ExecutionStatus> fromExchangeStatus(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "filled", "closed" -> Optional.of(FILLED);
            case "cancelled", "canceled", "expired" -> Optional.of(CANCELLED);
            case "partially_filled", "partial" -> Optional.of(PARTIALLY_FILLED);
            default -> Optional.empty();
        };
    }
}
