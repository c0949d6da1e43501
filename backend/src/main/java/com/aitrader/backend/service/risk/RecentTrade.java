package com.aitrader.backend.service.risk;

import java.time.LocalDateTime;

/**
 * @param side plan side, long or short
 */
public record RecentTrade(String symbol, String side, LocalDateTime createdAt) {
}
