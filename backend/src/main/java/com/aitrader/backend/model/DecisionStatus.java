package com.aitrader.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionStatus {
    PENDING("pending"),
    ALLOWED("allowed"),
    BLOCKED("blocked"),
    EXECUTED("executed"),
    FAILED("failed");

    private final String value;

    DecisionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static DecisionStatus fromString(String status) {
        for (DecisionStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status) || candidate.name().equalsIgnoreCase(status)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown decision status: " + status);
    }
}
