package com.aitrader.backend.repository;

import com.aitrader.backend.model.ModelConfig;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ModelConfigRepository extends JpaRepository<ModelConfig, Long> {
}
