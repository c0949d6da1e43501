package com.aitrader.backend.service.query;

import com.aitrader.backend.dto.ReplayChain;
import com.aitrader.backend.dto.ReplayStep;
import com.aitrader.backend.dto.SignalReplay;
import com.aitrader.backend.exception.NotFoundException;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.model.Execution;
import com.aitrader.backend.model.ExecutionOrderType;
import com.aitrader.backend.model.ExecutionStatus;
import com.aitrader.backend.model.MarketSnapshot;
import com.aitrader.backend.model.Signal;
import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.model.TradePlanStatus;
import com.aitrader.backend.repository.DecisionLogRepository;
import com.aitrader.backend.repository.ExecutionRepository;
import com.aitrader.backend.repository.MarketSnapshotRepository;
import com.aitrader.backend.repository.SignalRepository;
import com.aitrader.backend.repository.TradePlanRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReplayServiceTest {

    private static final String OHLCV = "[[1,10,11,9,10,100],[2,10,12,9,11,100],[3,11,12,10,11,100],"
            + "[4,11,13,10,12,100],[5,12,13,11,12,100],[6,12,14,11,13,100],[7,13,15,12,14,100]]";

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:05:00Z"), ZoneOffset.UTC);

    private DecisionLogRepository decisionLogRepository;
    private SignalRepository signalRepository;
    private MarketSnapshotRepository snapshotRepository;
    private TradePlanRepository tradePlanRepository;
    private ExecutionRepository executionRepository;
    private ReplayService service;

    private final Signal signal = Signal.builder()
            .id(42L).strategyId(2L).symbol("BTCUSDT").timeframe("1h").side("long")
            .score(new BigDecimal("0.90")).snapshotId(9L).reasonSummary("RSI breakout").build();
    private final MarketSnapshot snapshot = MarketSnapshot.builder()
            .id(9L).exchange("binance").symbol("BTCUSDT").timeframe("1h")
            .ohlcv(OHLCV).indicators("{\"rsi\":71.5}").build();
    private final DecisionLog decision = DecisionLog.builder()
            .id(100L).traderId(1L).signalId(42L).clientOrderId("Tabc").status(DecisionStatus.EXECUTED)
            .tradePlan("{\"action\":\"open\",\"symbol\":\"BTCUSDT\"}")
            .riskAllowed(true).riskReasons("[]").normalizedPlan("{\"quantity\":\"0.002\"}")
            .tradePlanId(7L).modelProvider("openai").modelName("gpt-4o").tokensUsed(120)
            .paper(false).build();
    private final TradePlan plan = TradePlan.builder()
            .id(7L).exchangeAccountId(4L).clientOrderId("Tabc").symbol("BTCUSDT").side("buy")
            .quantity(new BigDecimal("0.00200000")).tpPrice(new BigDecimal("51000"))
            .status(TradePlanStatus.ENTRY_FILLED).paper(false).errorMessage("x".repeat(300)).build();

    @BeforeEach
    void setUp() {
        decisionLogRepository = mock(DecisionLogRepository.class);
        signalRepository = mock(SignalRepository.class);
        snapshotRepository = mock(MarketSnapshotRepository.class);
        tradePlanRepository = mock(TradePlanRepository.class);
        executionRepository = mock(ExecutionRepository.class);
        service = new ReplayService(decisionLogRepository, signalRepository, snapshotRepository,
                tradePlanRepository, executionRepository, new ObjectMapper(), clock);

        when(decisionLogRepository.findById(100L)).thenReturn(Optional.of(decision));
        when(decisionLogRepository.findByTradePlanId(7L)).thenReturn(Optional.of(decision));
        when(signalRepository.findById(42L)).thenReturn(Optional.of(signal));
        when(snapshotRepository.findById(9L)).thenReturn(Optional.of(snapshot));
        when(tradePlanRepository.findById(7L)).thenReturn(Optional.of(plan));
        when(executionRepository.findByTradePlanIdOrderByCreatedAtAscIdAsc(7L)).thenReturn(List.of(
                Execution.builder().id(1L).tradePlanId(7L).orderType(ExecutionOrderType.ENTRY)
                        .exchangeOrderId("B-1").clientOrderId("Tabc").symbol("BTCUSDT").side("buy")
                        .quantity(new BigDecimal("0.002")).filledQuantity(new BigDecimal("0.002"))
                        .status(ExecutionStatus.FILLED).paper(false).build(),
                Execution.builder().id(2L).tradePlanId(7L).orderType(ExecutionOrderType.TP)
                        .clientOrderId("Tabc_TP").symbol("BTCUSDT").side("sell")
                        .quantity(new BigDecimal("0.002")).status(ExecutionStatus.FAILED)
                        .errorMessage("y".repeat(150)).paper(false).build()));
    }

    @Test
    void decisionReplayWalksTheWholeChainInOrder() {
        ReplayChain chain = service.replayDecision(100L);

        assertThat(chain.generatedAt()).isEqualTo(clock.instant());
        assertThat(chain.chain()).extracting(ReplayStep::type).containsExactly(
                "signal", "market_snapshot", "ai_decision", "risk_report", "trade_plan", "execution", "execution");
        assertThat(chain.chain()).extracting(ReplayStep::step).containsExactly(1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    void replayIsSanitized() {
        ReplayChain chain = service.replayDecision(100L);

        JsonNode ohlcv = (JsonNode) chain.chain().get(1).data().get("ohlcv_summary");
        assertThat(ohlcv.size()).isEqualTo(ReplayService.OHLCV_POINTS);
        assertThat(ohlcv.get(0).get(0).asInt()).isEqualTo(3);

        assertThat(chain.chain().get(2).data()).doesNotContainKeys("raw_response", "input_snapshot");
        assertThat(chain.chain().get(4).data().get("error_message")).asString().hasSize(100);
        assertThat(chain.chain().get(4).data().get("quantity")).isEqualTo("0.00200000");
        assertThat(chain.chain().get(5).data().get("filled_quantity")).isEqualTo("0.002");
        assertThat(chain.chain().get(6).data().get("filled_quantity")).isNull();
        assertThat(chain.chain().get(6).data().get("error_message")).asString().hasSize(100);
        assertThat(chain.chain().get(6).data().get("is_paper")).isEqualTo(false);
    }

    @Test
    void tradeReplayFindsDecisionThroughPlan() {
        ReplayChain chain = service.replayTrade(7L);

        assertThat(chain.chain()).hasSize(7);
        assertThat(chain.chain().get(2).data().get("client_order_id")).isEqualTo("Tabc");
    }

    @Test
    void decisionWithoutPlanStopsAtRiskReport() {
        DecisionLog blocked = DecisionLog.builder()
                .id(101L).traderId(1L).signalId(42L).clientOrderId("Tdef").status(DecisionStatus.BLOCKED)
                .riskAllowed(false).riskReasons("[\"Position qty below min\"]").build();
        when(decisionLogRepository.findById(101L)).thenReturn(Optional.of(blocked));

        ReplayChain chain = service.replayDecision(101L);

        assertThat(chain.chain()).extracting(ReplayStep::type)
                .containsExactly("signal", "market_snapshot", "ai_decision", "risk_report");
        JsonNode reasons = (JsonNode) chain.chain().get(3).data().get("reasons");
        assertThat(reasons.get(0).asText()).isEqualTo("Position qty below min");
    }

    @Test
    void signalReplayListsEveryTraderDecision() {
        when(decisionLogRepository.findBySignalId(42L)).thenReturn(List.of(decision));

        SignalReplay replay = service.replaySignal(42L);

        assertThat(replay.signal().get("score")).isEqualTo("0.90");
        assertThat(replay.marketSnapshot()).containsKey("indicators");
        assertThat(replay.decisions()).hasSize(1);
        assertThat(replay.decisions().get(0).get("trade_status")).isEqualTo("entry_filled");
    }

    @Test
    void missingRootsAreNotFound() {
        when(decisionLogRepository.findById(1L)).thenReturn(Optional.empty());
        when(tradePlanRepository.findById(1L)).thenReturn(Optional.empty());
        when(signalRepository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.replayDecision(1L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.replayTrade(1L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.replaySignal(1L)).isInstanceOf(NotFoundException.class);
    }
}
