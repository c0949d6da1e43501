package com.aitrader.backend.model;

public enum TraderMode {
    PAPER,
    LIVE
}
