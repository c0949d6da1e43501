package com.aitrader.backend.service.risk;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Precision-corrected order parameters ready for execution.
 *
 * @param side plan side, long or short
 */
public record NormalizedPlan(
        String symbol,
        String side,
        BigDecimal quantity,
        int leverage,
        String entryType,
        BigDecimal entryPrice,
        BigDecimal tpPrice,
        BigDecimal slPrice,
        String timeInForce
) {

    public boolean hasTpOrSl() {
        return tpPrice != null || slPrice != null;
    }

    /**
     * Persisted form. Decimals are written as strings.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("symbol", symbol);
        data.put("side", side);
        data.put("quantity", quantity.toPlainString());
        data.put("leverage", leverage);
        data.put("entry_type", entryType);
        data.put("entry_price", entryPrice == null ? null : entryPrice.toPlainString());
        data.put("tp_price", tpPrice == null ? null : tpPrice.toPlainString());
        data.put("sl_price", slPrice == null ? null : slPrice.toPlainString());
        data.put("time_in_force", timeInForce);
        return data;
    }
}
