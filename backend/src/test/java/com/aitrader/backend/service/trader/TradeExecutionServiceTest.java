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
import com.aitrader.backend.service.exchange.OrderStatus;
import com.aitrader.backend.service.risk.NormalizedPlan;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TradeExecutionServiceTest {

    private static final String CLIENT_ORDER_ID = "T0123456789abcdef";

    private TradePlanRepository tradePlanRepository;
    private ExecutionRepository executionRepository;
    private ExchangeAdapter adapter;
    private TradeExecutionService service;

    @BeforeEach
    void setUp() {
        tradePlanRepository = mock(TradePlanRepository.class);
        executionRepository = mock(ExecutionRepository.class);
        adapter = mock(ExchangeAdapter.class);
        when(tradePlanRepository.save(any(TradePlan.class))).thenAnswer(invocation -> {
            TradePlan plan = invocation.getArgument(0);
            if (plan.getId() == null) {
                plan.setId(11L);
            }
            return plan;
        });
        when(executionRepository.save(any(Execution.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(adapter.setLeverage(anyString(), anyInt())).thenReturn(true);

        service = new TradeExecutionService(tradePlanRepository, executionRepository, new TraderProperties(),
                new MetricsService(new SimpleMeterRegistry()), new ObjectMapper(),
                Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void paperPlanFillsAtCurrentPriceWithoutExchange() {
        TradePlan plan = service.execute(plan("51000", "49500"), 4L, CLIENT_ORDER_ID, true, adapter,
                new BigDecimal("50123.5"));

        assertThat(plan.getId()).isEqualTo(11L);
        assertThat(plan.isPaper()).isTrue();
        assertThat(plan.getStatus()).isEqualTo(TradePlanStatus.TP_SL_PLACED);
        assertThat(plan.getEntryPrice()).isEqualByComparingTo("50123.5");
        Execution entry = savedExecutions(1).get(0);
        assertThat(entry.getExchangeOrderId()).isEqualTo("PAPER-" + CLIENT_ORDER_ID);
        assertThat(entry.getStatus()).isEqualTo(ExecutionStatus.FILLED);
        assertThat(entry.getSide()).isEqualTo("BUY");
        assertThat(entry.isPaper()).isTrue();
        verifyNoInteractions(adapter);
    }

    @Test
    void paperPlanWithoutPriceOrTargetsUsesConfiguredFill() {
        TradePlan plan = service.execute(plan(null, null), 4L, CLIENT_ORDER_ID, true, adapter, null);

        assertThat(plan.getStatus()).isEqualTo(TradePlanStatus.ENTRY_FILLED);
        assertThat(plan.getEntryPrice()).isEqualByComparingTo("50000");
    }

    @Test
    void liveFilledEntryGetsProtectiveOrders() {
        when(adapter.placeMarketOrder("BTCUSDT", OrderSide.BUY, new BigDecimal("0.002"), CLIENT_ORDER_ID))
                .thenReturn(filled("1001", "50010"));
        when(adapter.placeTakeProfit(eq("BTCUSDT"), eq(OrderSide.SELL), any(), any(), eq(CLIENT_ORDER_ID + "_TP")))
                .thenReturn(accepted("1002"));
        when(adapter.placeStopLoss(eq("BTCUSDT"), eq(OrderSide.SELL), any(), any(), eq(CLIENT_ORDER_ID + "_SL")))
                .thenReturn(accepted("1003"));

        TradePlan plan = service.execute(plan("51000", "49500"), 4L, CLIENT_ORDER_ID, false, adapter,
                new BigDecimal("50000"));

        assertThat(plan.getStatus()).isEqualTo(TradePlanStatus.TP_SL_PLACED);
        assertThat(plan.getEntryPrice()).isEqualByComparingTo("50010");
        assertThat(plan.getErrorMessage()).isNull();
        verify(adapter).setLeverage("BTCUSDT", 5);

        List<Execution> executions = savedExecutions(3);
        assertThat(executions).extracting(Execution::getOrderType)
                .containsExactly(ExecutionOrderType.ENTRY, ExecutionOrderType.TP, ExecutionOrderType.SL);
        assertThat(executions).extracting(Execution::getStatus)
                .containsExactly(ExecutionStatus.FILLED, ExecutionStatus.SUBMITTED, ExecutionStatus.SUBMITTED);
        assertThat(executions.get(0).getFilledQuantity()).isEqualByComparingTo("0.002");
        assertThat(executions.get(1).getPrice()).isEqualByComparingTo("51000");
        assertThat(executions.get(1).getFilledQuantity()).isNull();
        assertThat(executions.get(2).getClientOrderId()).isEqualTo(CLIENT_ORDER_ID + "_SL");
    }

    @Test
    void takeProfitFailureKeepsFilledEntryAndStillPlacesStopLoss() {
        when(adapter.placeMarketOrder(any(), any(), any(), any())).thenReturn(filled("1001", "50010"));
        when(adapter.placeTakeProfit(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("connection reset"));
        when(adapter.placeStopLoss(any(), any(), any(), any(), any())).thenReturn(accepted("1003"));

        TradePlan plan = service.execute(plan("51000", "49500"), 4L, CLIENT_ORDER_ID, false, adapter,
                new BigDecimal("50000"));

        assertThat(plan.getStatus()).isEqualTo(TradePlanStatus.ENTRY_FILLED);
        assertThat(plan.getEntryPrice()).isEqualByComparingTo("50010");
        assertThat(plan.getErrorMessage()).isEqualTo("TP placement failed: EXCEPTION: connection reset");
        verify(adapter).placeStopLoss(any(), any(), any(), any(), any());

        List<Execution> executions = savedExecutions(3);
        assertThat(executions.get(1).getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(executions.get(2).getStatus()).isEqualTo(ExecutionStatus.SUBMITTED);
    }

    @Test
    void rejectedEntryFailsPlanWithoutProtectiveOrders() {
        when(adapter.placeMarketOrder(any(), any(), any(), any()))
                .thenReturn(OrderResult.failure("-2019", "Margin is insufficient."));

        TradePlan plan = service.execute(plan("51000", "49500"), 4L, CLIENT_ORDER_ID, false, adapter,
                new BigDecimal("50000"));

        assertThat(plan.getStatus()).isEqualTo(TradePlanStatus.FAILED);
        assertThat(plan.getErrorMessage()).isEqualTo("-2019: Margin is insufficient.");
        verify(adapter, never()).placeTakeProfit(any(), any(), any(), any(), any());
        verify(adapter, never()).placeStopLoss(any(), any(), any(), any(), any());
        assertThat(savedExecutions(1).get(0).getStatus()).isEqualTo(ExecutionStatus.FAILED);
    }

    @Test
    void unfilledEntryStaysPlaced() {
        when(adapter.placeMarketOrder(any(), any(), any(), any())).thenReturn(accepted("1001"));
        when(adapter.placeStopLoss(any(), any(), any(), any(), any())).thenReturn(accepted("1003"));

        TradePlan plan = service.execute(plan(null, "49500"), 4L, CLIENT_ORDER_ID, false, adapter,
                new BigDecimal("50000"));

        assertThat(plan.getStatus()).isEqualTo(TradePlanStatus.ENTRY_PLACED);
        assertThat(plan.getEntryPrice()).isNull();
        verify(adapter, never()).placeTakeProfit(any(), any(), any(), any(), any());
    }

    @Test
    void shortPlanSellsAndProtectsWithBuys() {
        NormalizedPlan shortPlan = new NormalizedPlan("ETHUSDT", "short", new BigDecimal("0.5"), 3, "market",
                null, new BigDecimal("2900"), new BigDecimal("3100"), null);
        when(adapter.placeMarketOrder(any(), any(), any(), any())).thenReturn(filled("7", "3000"));
        when(adapter.placeTakeProfit(any(), any(), any(), any(), any())).thenReturn(accepted("8"));
        when(adapter.placeStopLoss(any(), any(), any(), any(), any())).thenReturn(accepted("9"));

        service.execute(shortPlan, 4L, CLIENT_ORDER_ID, false, adapter, new BigDecimal("3000"));

        verify(adapter).placeMarketOrder("ETHUSDT", OrderSide.SELL, new BigDecimal("0.5"), CLIENT_ORDER_ID);
        verify(adapter).placeTakeProfit("ETHUSDT", OrderSide.BUY, new BigDecimal("0.5"), new BigDecimal("2900"),
                CLIENT_ORDER_ID + "_TP");
        verify(adapter).placeStopLoss("ETHUSDT", OrderSide.BUY, new BigDecimal("0.5"), new BigDecimal("3100"),
                CLIENT_ORDER_ID + "_SL");
    }

    @Test
    void truncatesLongErrors() {
        assertThat(TradeExecutionService.truncate("x".repeat(800))).hasSize(500);
        assertThat(TradeExecutionService.truncate(null)).isNull();
    }

    private List<Execution> savedExecutions(int expected) {
        ArgumentCaptor<Execution> captor = ArgumentCaptor.forClass(Execution.class);
        verify(executionRepository, times(expected)).save(captor.capture());
        return captor.getAllValues();
    }

    private static NormalizedPlan plan(String tp, String sl) {
        return new NormalizedPlan("BTCUSDT", "long", new BigDecimal("0.002"), 5, "market", null,
                tp == null ? null : new BigDecimal(tp), sl == null ? null : new BigDecimal(sl), null);
    }

    private static OrderResult filled(String orderId, String price) {
        return new OrderResult(true, orderId, CLIENT_ORDER_ID, OrderStatus.FILLED, new BigDecimal("0.002"),
                new BigDecimal(price), null, null, null);
    }

    private static OrderResult accepted(String orderId) {
        return new OrderResult(true, orderId, null, OrderStatus.NEW, BigDecimal.ZERO, null, null, null, null);
    }
}
