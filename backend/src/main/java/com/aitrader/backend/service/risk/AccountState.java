package com.aitrader.backend.service.risk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time account view, rebuilt every cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountState {

    @Builder.Default
    private BigDecimal availableBalance = BigDecimal.ZERO;

    private int openPositions;

    @Builder.Default
    private BigDecimal currentDailyPnl = BigDecimal.ZERO;

    @Builder.Default
    private List<RecentTrade> recentTrades = new ArrayList<>();

    public Map<String, Object> toPromptData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("available_balance", availableBalance.toPlainString());
        data.put("open_positions", openPositions);
        return data;
    }
}
