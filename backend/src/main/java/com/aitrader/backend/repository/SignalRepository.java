package com.aitrader.backend.repository;

import com.aitrader.backend.model.Signal;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SignalRepository extends JpaRepository<Signal, Long> {

    /**
     * Newest signals of the strategy that the trader has not produced a decision for yet.
     */
    @Query("SELECT s FROM Signal s WHERE s.strategyId = :strategyId AND NOT EXISTS ("
            + "SELECT 1 FROM DecisionLog d WHERE d.traderId = :traderId AND d.signalId = s.id) "
            + "ORDER BY s.createdAt DESC, s.id DESC")
    List<Signal> findUnconsumed(@Param("strategyId") Long strategyId,
                                @Param("traderId") Long traderId,
                                Pageable pageable);
}
