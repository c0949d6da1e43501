package com.aitrader.backend.repository;

import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface DecisionLogRepository extends JpaRepository<DecisionLog, Long> {

    boolean existsByClientOrderId(String clientOrderId);

    boolean existsByTraderIdAndSignalId(Long traderId, Long signalId);

    Optional<DecisionLog> findByTradePlanId(Long tradePlanId);

    List<DecisionLog> findBySignalId(Long signalId);

    List<DecisionLog> findByTraderIdAndStatusAndCreatedAtAfter(Long traderId, DecisionStatus status, LocalDateTime after);

    @Query("SELECT d FROM DecisionLog d WHERE (:traderId IS NULL OR d.traderId = :traderId) "
            + "AND (:status IS NULL OR d.status = :status) "
            + "AND (:paper IS NULL OR d.paper = :paper) "
            + "ORDER BY d.createdAt DESC, d.id DESC")
    List<DecisionLog> search(@Param("traderId") Long traderId,
                             @Param("status") DecisionStatus status,
                             @Param("paper") Boolean paper,
                             Pageable pageable);

    @Query("SELECT COUNT(d) FROM DecisionLog d WHERE (:traderId IS NULL OR d.traderId = :traderId) "
            + "AND (:status IS NULL OR d.status = :status) "
            + "AND (:paper IS NULL OR d.paper = :paper)")
    long countFiltered(@Param("traderId") Long traderId,
                       @Param("status") DecisionStatus status,
                       @Param("paper") Boolean paper);
}
