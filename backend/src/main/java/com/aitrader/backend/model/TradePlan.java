package com.aitrader.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "trade_plans", indexes = {
        @Index(name = "ix_trade_plans_account_status", columnList = "exchangeAccountId,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class TradePlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long exchangeAccountId;

    @Column(nullable = false, unique = true, length = 100)
    private String clientOrderId;

    @Column(nullable = false, length = 50)
    private String symbol;

    @Column(nullable = false, length = 10)
    private String side;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(precision = 20, scale = 8)
    private BigDecimal entryPrice;

    @Column(precision = 20, scale = 8)
    private BigDecimal tpPrice;

    @Column(precision = 20, scale = 8)
    private BigDecimal slPrice;

    @Column(nullable = false, precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal leverage = BigDecimal.ONE;

    @Column(columnDefinition = "TEXT")
    private String entryOrder;

    @Column(columnDefinition = "TEXT")
    private String tpOrder;

    @Column(columnDefinition = "TEXT")
    private String slOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TradePlanStatus status = TradePlanStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private boolean paper = true;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

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

    /**
     * Moves the plan forward.
     * @throws IllegalStateException if the target would move the plan backwards or out of a terminal state
     */
    public void transitionTo(TradePlanStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format("Invalid trade plan transition: %s -> %s for %s",
                    status, target, clientOrderId));
        }
        if (status == target) {
            return;
        }
        TradePlanStatus previous = status;
        status = target;
        updatedAt = LocalDateTime.now();
        log.info("Trade plan transition clientOrderId={} from={} to={}", clientOrderId, previous, target);
    }

    /**
     * Same as {@link #transitionTo} but silently ignores transitions that would regress.
     */
    public boolean advanceTo(TradePlanStatus target) {
        if (status == target || !status.canTransitionTo(target)) {
            return false;
        }
        transitionTo(target);
        return true;
    }
}
