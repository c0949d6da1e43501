package com.aitrader.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Audit record for one signal evaluated by one trader. JSON columns hold
 * Jackson-serialized payloads; raw model text is never stored.
 */
@Entity
@Table(name = "decision_logs", indexes = {
        @Index(name = "ix_decision_logs_trader", columnList = "traderId"),
        @Index(name = "ix_decision_logs_signal", columnList = "signalId"),
        @Index(name = "ix_decision_logs_status", columnList = "status"),
        @Index(name = "ix_decision_logs_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long traderId;

    private Long signalId;

    @Column(nullable = false, unique = true, length = 100)
    private String clientOrderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DecisionStatus status = DecisionStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String inputSnapshot;

    @Column(columnDefinition = "TEXT")
    private String tradePlan;

    @Column(precision = 3, scale = 2)
    private BigDecimal confidence;

    @Column(columnDefinition = "TEXT")
    private String reasonSummary;

    @Column(columnDefinition = "TEXT")
    private String evidence;

    private Boolean riskAllowed;

    @Column(columnDefinition = "TEXT")
    private String riskReasons;

    @Column(columnDefinition = "TEXT")
    private String normalizedPlan;

    private Long tradePlanId;

    @Column(columnDefinition = "TEXT")
    private String executionError;

    @Column(length = 50)
    private String modelProvider;

    @Column(length = 100)
    private String modelName;

    private Integer tokensUsed;

    @Column(nullable = false)
    @Builder.Default
    private boolean paper = true;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
