package com.aitrader.backend.repository;

import com.aitrader.backend.model.ExchangeAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExchangeAccountRepository extends JpaRepository<ExchangeAccount, Long> {
    List<ExchangeAccount> findByStatus(String status);
}
