package com.aitrader.backend.dto;

public record DecisionStatsDto(long total, long executed, long blocked, long failed, long paper, long live) {
}
