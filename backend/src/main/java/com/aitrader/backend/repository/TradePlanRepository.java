package com.aitrader.backend.repository;

import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.model.TradePlanStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TradePlanRepository extends JpaRepository<TradePlan, Long> {

    Optional<TradePlan> findByClientOrderId(String clientOrderId);

    List<TradePlan> findByExchangeAccountIdAndPaperFalseAndCreatedAtAfterAndStatusInOrderByCreatedAtAsc(
            Long exchangeAccountId,
            LocalDateTime createdAfter,
            Collection<TradePlanStatus> statuses,
            Pageable pageable);

    @Query("SELECT p FROM TradePlan p, DecisionLog d WHERE d.tradePlanId = p.id "
            + "AND (:traderId IS NULL OR d.traderId = :traderId) "
            + "AND (:status IS NULL OR p.status = :status) "
            + "AND (:paper IS NULL OR p.paper = :paper) "
            + "ORDER BY p.createdAt DESC, p.id DESC")
    List<TradePlan> search(@Param("traderId") Long traderId,
                           @Param("status") TradePlanStatus status,
                           @Param("paper") Boolean paper,
                           Pageable pageable);
}
