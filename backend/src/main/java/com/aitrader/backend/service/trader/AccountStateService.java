package com.aitrader.backend.service.trader;

import com.aitrader.backend.config.TraderProperties;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.repository.DecisionLogRepository;
import com.aitrader.backend.service.exchange.ExchangeAdapter;
import com.aitrader.backend.service.risk.AccountState;
import com.aitrader.backend.service.risk.RecentTrade;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a fresh {@link AccountState} for each signal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AccountStateService {

    static final String QUOTE_ASSET = "USDT";

    private final DecisionLogRepository decisionLogRepository;
    private final TraderProperties traderProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AccountState build(ExchangeAdapter adapter, Long traderId) {
        BigDecimal balance;
        int openPositions;
        try {
            balance = adapter.getBalance(QUOTE_ASSET);
            openPositions = adapter.getPositions().size();
        } catch (RuntimeException e) {
            log.warn("Account state unavailable from {}, assuming empty account: {}",
                    adapter.exchange().getId(), e.getMessage());
            balance = BigDecimal.ZERO;
            openPositions = 0;
        }

        return AccountState.builder()
                .availableBalance(balance == null ? BigDecimal.ZERO : balance)
                .openPositions(openPositions)
                .currentDailyPnl(BigDecimal.ZERO)
                .recentTrades(recentTrades(traderId))
                .build();
    }

    /**
     * Executed decisions inside the recent-trades window, read from their normalized plans.
     */
    List<RecentTrade> recentTrades(Long traderId) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(traderProperties.getRecentTradesHours());
        List<RecentTrade> trades = new ArrayList<>();
        for (DecisionLog decision : decisionLogRepository.findByTraderIdAndStatusAndCreatedAtAfter(
                traderId, DecisionStatus.EXECUTED, cutoff)) {
            if (decision.getNormalizedPlan() == null) {
                continue;
            }
            try {
                JsonNode plan = objectMapper.readTree(decision.getNormalizedPlan());
                trades.add(new RecentTrade(plan.path("symbol").asText(null), plan.path("side").asText(null),
                        decision.getCreatedAt()));
            } catch (JsonProcessingException e) {
                log.warn("Skipping decision {} with unreadable normalized plan", decision.getId());
            }
        }
        return trades;
    }
}
