package com.aitrader.backend.service.trader;

import java.util.List;

/**
 * Outcome of one trader cycle.
 *
 * @param lockAcquired false when another worker was already running this trader
 * @param decisionIds decisions written during the cycle
 * @param error why the trader could not be processed, null otherwise
 */
public record CycleReport(Long traderId, boolean lockAcquired, List<Long> decisionIds, String error) {

    public static CycleReport skipped(Long traderId) {
        return new CycleReport(traderId, false, List.of(), null);
    }

    public static CycleReport completed(Long traderId, List<Long> decisionIds) {
        return new CycleReport(traderId, true, decisionIds, null);
    }

    public static CycleReport failed(Long traderId, String error) {
        return new CycleReport(traderId, true, List.of(), error);
    }
}
