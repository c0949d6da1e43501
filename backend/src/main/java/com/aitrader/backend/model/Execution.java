package com.aitrader.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One exchange order (entry, take profit or stop loss) owned by a trade plan.
 */
@Entity
@Table(name = "executions", indexes = {
        @Index(name = "ix_executions_trade_plan", columnList = "tradePlanId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long tradePlanId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExecutionOrderType orderType;

    @Column(unique = true, length = 100)
    private String exchangeOrderId;

    @Column(nullable = false, length = 100)
    private String clientOrderId;

    @Column(nullable = false, length = 50)
    private String symbol;

    @Column(nullable = false, length = 10)
    private String side;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal quantity;

    // ordered quantity stays in quantity
    @Column(precision = 20, scale = 8)
    private BigDecimal filledQuantity;

    @Column(precision = 20, scale = 8)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String exchangeResponse;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(nullable = false)
    @Builder.Default
    private boolean paper = true;

    private LocalDateTime filledAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
