package com.aitrader.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

@Entity
@Table(name = "exchange_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeAccount {

    public static final String STATUS_ACTIVE = "active";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String exchange;

    @Column(nullable = false, length = 100)
    private String label;

    @ToString.Exclude
    @Column(nullable = false, columnDefinition = "TEXT")
    private String apiKeyEncrypted;

    @ToString.Exclude
    @Column(nullable = false, columnDefinition = "TEXT")
    private String apiSecretEncrypted;

    @Column(nullable = false)
    @Builder.Default
    private boolean testnet = false;

    @Column(nullable = false, length = 50)
    @Builder.Default
    private String status = STATUS_ACTIVE;

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
