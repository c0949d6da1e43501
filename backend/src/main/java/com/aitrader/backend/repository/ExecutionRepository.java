package com.aitrader.backend.repository;

import com.aitrader.backend.model.Execution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExecutionRepository extends JpaRepository<Execution, Long> {
    List<Execution> findByTradePlanIdOrderByCreatedAtAscIdAsc(Long tradePlanId);
}
