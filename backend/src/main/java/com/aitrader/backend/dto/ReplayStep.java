package com.aitrader.backend.dto;

import java.util.Map;

/**
 * @param type signal, market_snapshot, ai_decision, risk_report, trade_plan or execution
 */
public record ReplayStep(int step, String type, Map<String, Object> data) {
}
