package com.aitrader.backend.service.exchange;

import com.aitrader.backend.model.ExecutionStatus;

/**
 * Normalized order status shared by all exchanges.
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED;

    public ExecutionStatus toExecutionStatus() {
        return switch (this) {
            case NEW -> ExecutionStatus.SUBMITTED;
            case PARTIALLY_FILLED -> ExecutionStatus.PARTIALLY_FILLED;
            case FILLED -> ExecutionStatus.FILLED;
            case CANCELED, EXPIRED -> ExecutionStatus.CANCELLED;
            case REJECTED -> ExecutionStatus.FAILED;
        };
    }
}
