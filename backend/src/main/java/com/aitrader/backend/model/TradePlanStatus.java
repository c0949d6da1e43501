package com.aitrader.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trade plan lifecycle.
 * pending -> entry_placed -> entry_filled -> tp_sl_placed -> completed,
 * with failed and cancelled reachable from any non-terminal state.
 */
public enum TradePlanStatus {
    PENDING("pending", 0),
    ENTRY_PLACED("entry_placed", 1),
    ENTRY_FILLED("entry_filled", 2),
    TP_SL_PLACED("tp_sl_placed", 3),
    COMPLETED("completed", 4),
    FAILED("failed", 5),
    CANCELLED("cancelled", 5);

    private final String value;
    private final int rank;

    TradePlanStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Forward-only check. Self transitions are accepted so repeated updates stay idempotent.
     */
    public boolean canTransitionTo(TradePlanStatus target) {
        if (target == null) return false;
        if (this == target) return true;
        if (isTerminal()) return false;
        if (target == FAILED || target == CANCELLED) return true;
        return target.rank > this.rank;
    }

    public static TradePlanStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            return PENDING;
        }
        for (TradePlanStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status) || candidate.name().equalsIgnoreCase(status)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown trade plan status: " + status);
    }
}
