package com.aitrader.backend.repository;

import com.aitrader.backend.model.MarketSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MarketSnapshotRepository extends JpaRepository<MarketSnapshot, Long> {
}
