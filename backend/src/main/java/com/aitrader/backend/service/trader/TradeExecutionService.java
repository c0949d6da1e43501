package com.aitrader.backend.service.trader;

import com.aitrader.backend.config.TraderProperties;
import com.aitrader.backend.model.Execution;
import com.aitrader.backend.model.ExecutionOrderType;
import com.aitrader.backend.model.ExecutionStatus;
import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.model.TradePlanStatus;
import com.aitrader.backend.repository.ExecutionRepository;
import com.aitrader.backend.repository.TradePlanRepository;
import com.aitrader.backend.service.MetricsService;
import com.aitrader.backend.service.exchange.ExchangeAdapter;
import com.aitrader.backend.service.exchange.OrderResult;
import com.aitrader.backend.service.exchange.OrderSide;
import com.aitrader.backend.service.risk.ClientOrderIds;
import com.aitrader.backend.service.risk.NormalizedPlan;
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
import java.util.function.Supplier;

/**
 * Turns an approved plan into a persisted {@link TradePlan} and its orders. Live plans go to the
 * exchange; paper plans are filled immediately at a simulated price.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeExecutionService {

    static final int MAX_ERROR_LENGTH = 500;

    private final TradePlanRepository tradePlanRepository;
    private final ExecutionRepository executionRepository;
    private final TraderProperties traderProperties;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param currentPrice mark price at decision time, may be null
     */
    public TradePlan execute(NormalizedPlan normalized, Long exchangeAccountId, String clientOrderId, boolean paper,
                             ExchangeAdapter adapter, BigDecimal currentPrice) {
        TradePlan plan = tradePlanRepository.save(TradePlan.builder()
                .exchangeAccountId(exchangeAccountId)
                .clientOrderId(clientOrderId)
                .symbol(normalized.symbol())
                .side(normalized.side())
                .quantity(normalized.quantity())
                .entryPrice(normalized.entryPrice())
                .tpPrice(normalized.tpPrice())
                .slPrice(normalized.slPrice())
                .leverage(BigDecimal.valueOf(normalized.leverage()))
                .status(TradePlanStatus.PENDING)
                .paper(paper)
                .build());

        if (paper) {
            return executePaper(plan, normalized, currentPrice);
        }
        return executeLive(plan, normalized, adapter, currentPrice);
    }

    private TradePlan executePaper(TradePlan plan, NormalizedPlan normalized, BigDecimal currentPrice) {
        BigDecimal fillPrice = firstNonNull(normalized.entryPrice(), currentPrice, traderProperties.getPaperFillPrice());
        OrderSide entrySide = OrderSide.forPositionSide(normalized.side());

        plan.transitionTo(TradePlanStatus.ENTRY_FILLED);
        plan.setEntryPrice(fillPrice);
        executionRepository.save(Execution.builder()
                .tradePlanId(plan.getId())
                .orderType(ExecutionOrderType.ENTRY)
                .exchangeOrderId("PAPER-" + plan.getClientOrderId())
                .clientOrderId(plan.getClientOrderId())
                .symbol(normalized.symbol())
                .side(entrySide.name())
                .quantity(normalized.quantity())
                .filledQuantity(normalized.quantity())
                .price(fillPrice)
                .status(ExecutionStatus.FILLED)
                .paper(true)
                .filledAt(LocalDateTime.now(clock))
                .build());
        metricsService.recordExecution(ExecutionOrderType.ENTRY.getValue(), "paper");

        if (normalized.hasTpOrSl()) {
            plan.transitionTo(TradePlanStatus.TP_SL_PLACED);
        }
        log.info("Paper fill {} {} qty={} at {}", normalized.symbol(), normalized.side(), normalized.quantity(), fillPrice);
        return tradePlanRepository.save(plan);
    }

    private TradePlan executeLive(TradePlan plan, NormalizedPlan normalized, ExchangeAdapter adapter,
                                  BigDecimal currentPrice) {
        String symbol = normalized.symbol();
        if (!adapter.setLeverage(symbol, normalized.leverage())) {
            log.warn("Leverage {}x not confirmed for {}, placing entry anyway", normalized.leverage(), symbol);
        }

        OrderSide entrySide = OrderSide.forPositionSide(normalized.side());
        OrderResult entry = place(() -> adapter.placeMarketOrder(symbol, entrySide, normalized.quantity(),
                plan.getClientOrderId()));
        recordExecution(plan, ExecutionOrderType.ENTRY, plan.getClientOrderId(), entrySide, normalized.quantity(),
                null, entry);
        plan.setEntryOrder(toJson(entry.raw()));

        if (!entry.success()) {
            plan.transitionTo(TradePlanStatus.FAILED);
            plan.setErrorMessage(truncate(describe(entry)));
            log.warn("Entry rejected for {}: {}", plan.getClientOrderId(), plan.getErrorMessage());
            return tradePlanRepository.save(plan);
        }

        if (entry.isFilled()) {
            plan.transitionTo(TradePlanStatus.ENTRY_FILLED);
            plan.setEntryPrice(firstNonNull(entry.filledPrice(), currentPrice, normalized.entryPrice()));
        } else {
            plan.transitionTo(TradePlanStatus.ENTRY_PLACED);
        }
        TradePlan saved = tradePlanRepository.save(plan);

        if (!normalized.hasTpOrSl()) {
            return saved;
        }

        // TP and SL are placed independently of each other
        OrderSide closeSide = entrySide.opposite();
        List<String> errors = new ArrayList<>();
        if (normalized.tpPrice() != null) {
            String tpId = ClientOrderIds.takeProfit(saved.getClientOrderId());
            OrderResult tp = place(() -> adapter.placeTakeProfit(symbol, closeSide, normalized.quantity(),
                    normalized.tpPrice(), tpId));
            recordExecution(saved, ExecutionOrderType.TP, tpId, closeSide, normalized.quantity(), normalized.tpPrice(), tp);
            saved.setTpOrder(toJson(tp.raw()));
            if (!tp.success()) {
                errors.add("TP placement failed: " + describe(tp));
            }
        }
        if (normalized.slPrice() != null) {
            String slId = ClientOrderIds.stopLoss(saved.getClientOrderId());
            OrderResult sl = place(() -> adapter.placeStopLoss(symbol, closeSide, normalized.quantity(),
                    normalized.slPrice(), slId));
            recordExecution(saved, ExecutionOrderType.SL, slId, closeSide, normalized.quantity(), normalized.slPrice(), sl);
            saved.setSlOrder(toJson(sl.raw()));
            if (!sl.success()) {
                errors.add("SL placement failed: " + describe(sl));
            }
        }

        if (errors.isEmpty()) {
            if (saved.getStatus() == TradePlanStatus.ENTRY_FILLED) {
                saved.transitionTo(TradePlanStatus.TP_SL_PLACED);
            }
        } else {
            saved.setErrorMessage(truncate(String.join("; ", errors)));
            log.error("Position open without full protection clientOrderId={} status={}: {}",
                    saved.getClientOrderId(), saved.getStatus().getValue(), saved.getErrorMessage());
        }
        return tradePlanRepository.save(saved);
    }

    /**
     * Adapters report exchange failures as results; anything thrown is folded in the same way.
     */
    private OrderResult place(Supplier<OrderResult> placement) {
        try {
            return placement.get();
        } catch (RuntimeException e) {
            log.warn("Order placement threw: {}", e.toString());
            return OrderResult.failure("EXCEPTION", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void recordExecution(TradePlan plan, ExecutionOrderType type, String clientOrderId, OrderSide side,
                                 BigDecimal quantity, BigDecimal stopPrice, OrderResult result) {
        ExecutionStatus status = !result.success() ? ExecutionStatus.FAILED
                : result.status() != null ? result.status().toExecutionStatus() : ExecutionStatus.SUBMITTED;
        Execution execution = Execution.builder()
                .tradePlanId(plan.getId())
                .orderType(type)
                .exchangeOrderId(result.orderId())
                .clientOrderId(clientOrderId)
                .symbol(plan.getSymbol())
                .side(side.name())
                .quantity(quantity)
                .filledQuantity(result.success() ? positiveOrNull(result.filledQty()) : null)
                .price(result.filledPrice() != null ? result.filledPrice() : stopPrice)
                .status(status)
                .exchangeResponse(toJson(result.raw()))
                .errorMessage(result.success() ? null : truncate(describe(result)))
                .paper(false)
                .filledAt(status == ExecutionStatus.FILLED ? LocalDateTime.now(clock) : null)
                .build();
        executionRepository.save(execution);
        metricsService.recordExecution(type.getValue(), status.getValue());
    }

    private static BigDecimal positiveOrNull(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : null;
    }

    private static String describe(OrderResult result) {
        if (result.errorCode() == null) {
            return String.valueOf(result.errorMessage());
        }
        return result.errorCode() + ": " + result.errorMessage();
    }

    private String toJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize exchange response", e);
        }
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
