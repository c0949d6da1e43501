package com.aitrader.backend.service.risk;

import java.util.List;

/**
 * Gate verdict. A normalized plan is present only when allowed and an order is to be placed.
 */
public record RiskReport(boolean allowed, List<String> reasons, NormalizedPlan normalizedPlan) {

    public static RiskReport allow(String reason) {
        return new RiskReport(true, List.of(reason), null);
    }

    public static RiskReport allow(NormalizedPlan plan) {
        return new RiskReport(true, List.of(), plan);
    }

    public static RiskReport block(List<String> reasons) {
        return new RiskReport(false, List.copyOf(reasons), null);
    }
}
