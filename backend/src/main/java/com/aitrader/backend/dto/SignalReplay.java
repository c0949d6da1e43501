package com.aitrader.backend.dto;

import java.util.List;
import java.util.Map;

/**
 * A signal with every decision traders made on it.
 *
 * @param marketSnapshot null when the signal has no snapshot
 */
public record SignalReplay(Map<String, Object> signal, Map<String, Object> marketSnapshot,
                           List<Map<String, Object>> decisions) {
}
