package com.aitrader.backend.service.plan;

import java.util.List;

public record ValidationResult(boolean valid, TradePlanOutput plan, List<String> errors) {

    public static ValidationResult ok(TradePlanOutput plan) {
        return new ValidationResult(true, plan, List.of());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, null, List.copyOf(errors));
    }

    public static ValidationResult invalid(String error) {
        return invalid(List.of(error));
    }
}
