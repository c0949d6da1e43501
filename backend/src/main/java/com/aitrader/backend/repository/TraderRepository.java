package com.aitrader.backend.repository;

import com.aitrader.backend.model.Trader;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TraderRepository extends JpaRepository<Trader, Long> {
    Optional<Trader> findByIdAndEnabledTrue(Long id);

    List<Trader> findByEnabledTrue();
}
