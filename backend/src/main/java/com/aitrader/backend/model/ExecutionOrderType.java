package com.aitrader.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionOrderType {
    ENTRY("entry"),
    TP("tp"),
    SL("sl");

    private final String value;

    ExecutionOrderType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
