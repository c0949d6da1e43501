package com.aitrader.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "market_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String exchange;

    @Column(nullable = false, length = 50)
    private String symbol;

    @Column(nullable = false, length = 10)
    private String timeframe;

    @Column(name = "snapshot_time", nullable = false)
    private LocalDateTime timestamp;

    // {"open":[..],"high":[..],"low":[..],"close":[..],"volume":[..]}
    @Column(nullable = false, columnDefinition = "TEXT")
    private String ohlcv;

    @Column(columnDefinition = "TEXT")
    private String indicators;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
