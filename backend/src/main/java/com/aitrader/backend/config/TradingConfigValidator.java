package com.aitrader.backend.config;

import com.aitrader.backend.model.ExchangeAccount;
import com.aitrader.backend.model.ModelConfig;
import com.aitrader.backend.repository.ExchangeAccountRepository;
import com.aitrader.backend.repository.ModelConfigRepository;
import com.aitrader.backend.service.ai.ModelProvider;
import com.aitrader.backend.service.exchange.ExchangeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a stored account or model config names an exchange or provider this
 * build cannot talk to.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TradingConfigValidator implements ApplicationRunner {

    private final ExchangeAccountRepository accountRepository;
    private final ModelConfigRepository modelConfigRepository;
    private final TraderProperties traderProperties;

    @Override
    public void run(ApplicationArguments args) {
        for (ExchangeAccount account : accountRepository.findByStatus(ExchangeAccount.STATUS_ACTIVE)) {
            ExchangeType.fromString(account.getExchange());
        }
        for (ModelConfig config : modelConfigRepository.findAll()) {
            ModelProvider.fromString(config.getProvider());
        }
        if (traderProperties.isPaperTrading()) {
            log.info("Global paper trading is on, no live orders will be sent");
        }
    }
}
