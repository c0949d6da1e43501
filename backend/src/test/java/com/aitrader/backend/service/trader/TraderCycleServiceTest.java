package com.aitrader.backend.service.trader;

import com.aitrader.backend.config.LockProperties;
import com.aitrader.backend.config.TraderProperties;
import com.aitrader.backend.exception.SecretsException;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.model.ExchangeAccount;
import com.aitrader.backend.model.ModelConfig;
import com.aitrader.backend.model.Signal;
import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.model.TradePlanStatus;
import com.aitrader.backend.model.Trader;
import com.aitrader.backend.model.TraderMode;
import com.aitrader.backend.repository.DecisionLogRepository;
import com.aitrader.backend.repository.ExchangeAccountRepository;
import com.aitrader.backend.repository.MarketSnapshotRepository;
import com.aitrader.backend.repository.ModelConfigRepository;
import com.aitrader.backend.repository.SignalRepository;
import com.aitrader.backend.repository.StrategyRepository;
import com.aitrader.backend.repository.TraderRepository;
import com.aitrader.backend.service.MetricsService;
import com.aitrader.backend.service.ai.ModelErrorType;
import com.aitrader.backend.service.ai.ModelResponse;
import com.aitrader.backend.service.ai.ModelRouter;
import com.aitrader.backend.service.exchange.ExchangeAdapter;
import com.aitrader.backend.service.exchange.ExchangeAdapterFactory;
import com.aitrader.backend.service.exchange.ExchangeType;
import com.aitrader.backend.service.lock.InMemoryLockStore;
import com.aitrader.backend.service.lock.MutexFactory;
import com.aitrader.backend.service.lock.StoreBackedMutex;
import com.aitrader.backend.service.plan.PromptBuilder;
import com.aitrader.backend.service.plan.TradePlanSchema;
import com.aitrader.backend.service.plan.TradePlanValidator;
import com.aitrader.backend.service.risk.NormalizedPlan;
import com.aitrader.backend.service.risk.RiskManager;
import com.aitrader.backend.service.risk.RiskProfileFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TraderCycleServiceTest {

    private static final String OPEN_PLAN = "{\"action\":\"open\",\"symbol\":\"BTCUSDT\",\"side\":\"long\","
            + "\"entry\":{\"type\":\"market\"},\"position_size\":{\"mode\":\"notional\",\"value\":100},"
            + "\"leverage\":%d,\"tp\":{\"mode\":\"percent\",\"value\":2},\"sl\":{\"mode\":\"percent\",\"value\":1},"
            + "\"confidence\":0.8,\"reason_summary\":\"Breakout\"}";

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:20Z"), ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper();

    private TraderRepository traderRepository;
    private SignalRepository signalRepository;
    private StrategyRepository strategyRepository;
    private ExchangeAccountRepository accountRepository;
    private ModelConfigRepository modelConfigRepository;
    private DecisionLogRepository decisionLogRepository;
    private ExchangeAdapterFactory adapterFactory;
    private ModelRouter modelRouter;
    private TradeExecutionService executionService;
    private MutableClock lockClock;
    private InMemoryLockStore lockStore;
    private MutexFactory mutexFactory;
    private SimpleMeterRegistry meterRegistry;
    private ExchangeAdapter adapter;
    private TraderCycleService service;

    private final Trader trader = Trader.builder()
            .id(1L).name("alpha").exchangeAccountId(4L).modelConfigId(3L).strategyId(2L)
            .enabled(true).mode(TraderMode.PAPER).build();
    private final ExchangeAccount account = ExchangeAccount.builder()
            .id(4L).exchange("binance").label("main").apiKeyEncrypted("v1:k").apiSecretEncrypted("v1:s").build();
    private final ModelConfig modelConfig = ModelConfig.builder()
            .id(3L).provider("openai").modelName("gpt-4o").label("primary").apiKeyEncrypted("v1:m").build();
    private final Signal signal = Signal.builder()
            .id(42L).strategyId(2L).symbol("BTCUSDT").timeframe("1h").side("long")
            .score(new BigDecimal("0.9")).reasonSummary("RSI breakout").build();

    @BeforeEach
    void setUp() {
        traderRepository = mock(TraderRepository.class);
        signalRepository = mock(SignalRepository.class);
        strategyRepository = mock(StrategyRepository.class);
        accountRepository = mock(ExchangeAccountRepository.class);
        modelConfigRepository = mock(ModelConfigRepository.class);
        decisionLogRepository = mock(DecisionLogRepository.class);
        adapterFactory = mock(ExchangeAdapterFactory.class);
        modelRouter = mock(ModelRouter.class);
        executionService = mock(TradeExecutionService.class);
        adapter = mock(ExchangeAdapter.class);

        when(decisionLogRepository.save(any(DecisionLog.class))).thenAnswer(invocation -> {
            DecisionLog decision = invocation.getArgument(0);
            if (decision.getId() == null) {
                decision.setId(100L);
            }
            return decision;
        });
        when(adapter.exchange()).thenReturn(ExchangeType.BINANCE);
        when(adapter.getTicker("BTCUSDT")).thenReturn(new BigDecimal("50000"));
        when(adapter.getBalance("USDT")).thenReturn(new BigDecimal("1000"));
        when(adapter.getPositions()).thenReturn(List.of());

        TraderProperties traderProperties = new TraderProperties();
        LockProperties lockProperties = new LockProperties();
        lockProperties.setBlockingTimeoutSeconds(0);
        lockProperties.setTraderCycleTtlSeconds(60);
        lockClock = new MutableClock(clock.instant());
        lockStore = new InMemoryLockStore(lockClock);
        mutexFactory = new MutexFactory(lockStore, lockProperties);
        meterRegistry = new SimpleMeterRegistry();

        service = new TraderCycleService(traderRepository, signalRepository, mock(MarketSnapshotRepository.class),
                strategyRepository, accountRepository, modelConfigRepository, decisionLogRepository, adapterFactory,
                modelRouter, new PromptBuilder(objectMapper), new TradePlanSchema(objectMapper),
                new TradePlanValidator(), new RiskManager(clock), new RiskProfileFactory(traderProperties, objectMapper),
                new AccountStateService(decisionLogRepository, traderProperties, objectMapper, clock),
                executionService, mutexFactory,
                new MetricsService(meterRegistry), traderProperties, objectMapper, Runnable::run, clock);
    }

    @Test
    void repeatedSignalWithinMinuteIsProcessedOnce() {
        when(decisionLogRepository.existsByClientOrderId(anyString())).thenReturn(false, true);
        modelReturns(skipPlan());

        Long first = process();
        Long second = process();

        assertThat(first).isEqualTo(100L);
        assertThat(second).isNull();
        ArgumentCaptor<String> ids = ArgumentCaptor.forClass(String.class);
        verify(decisionLogRepository, times(2)).existsByClientOrderId(ids.capture());
        assertThat(ids.getAllValues().get(0)).isEqualTo(ids.getAllValues().get(1));
        verify(modelRouter, times(1)).generate(any(), any(), anyString(), anyString(), any());
    }

    @Test
    void modelFailureIsRecordedAsFailedDecision() {
        when(modelRouter.generate(any(), any(), anyString(), anyString(), any()))
                .thenReturn(ModelResponse.failure(ModelErrorType.AUTH, "bad key"));

        process();

        DecisionLog decision = lastSavedDecision();
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.FAILED);
        assertThat(decision.getExecutionError()).isEqualTo("AI error: auth");
        assertThat(decision.getModelProvider()).isEqualTo("openai");
        verify(executionService, never()).execute(any(), any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void invalidModelOutputFailsDecision() {
        modelReturns("I think you should buy");

        process();

        DecisionLog decision = lastSavedDecision();
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.FAILED);
        assertThat(decision.getExecutionError()).startsWith("Invalid JSON");
        assertThat(decision.getTokensUsed()).isEqualTo(20);
    }

    @Test
    void skipIsAllowedWithoutExecution() {
        modelReturns(skipPlan());

        process();

        DecisionLog decision = lastSavedDecision();
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.ALLOWED);
        assertThat(decision.getRiskAllowed()).isTrue();
        assertThat(decision.getRiskReasons()).isEqualTo("[\"Action is skip\"]");
        assertThat(decision.getReasonSummary()).isEqualTo("Quiet market");
        verify(executionService, never()).execute(any(), any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void excessiveLeverageIsBlocked() {
        modelReturns(String.format(OPEN_PLAN, 20));

        process();

        DecisionLog decision = lastSavedDecision();
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.BLOCKED);
        assertThat(decision.getRiskAllowed()).isFalse();
        assertThat(decision.getRiskReasons()).contains("Leverage 20 exceeds max 10");
        assertThat(decision.getNormalizedPlan()).isNull();
        verify(executionService, never()).execute(any(), any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void allowedPlanIsExecutedOnPaper() {
        modelReturns(String.format(OPEN_PLAN, 5));
        TradePlan executed = TradePlan.builder().id(55L).clientOrderId("T1").symbol("BTCUSDT").side("long")
                .quantity(new BigDecimal("0.002")).status(TradePlanStatus.TP_SL_PLACED).paper(true).build();
        when(executionService.execute(any(NormalizedPlan.class), eq(4L), anyString(), eq(true), eq(adapter), any()))
                .thenReturn(executed);

        process();

        DecisionLog decision = lastSavedDecision();
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.EXECUTED);
        assertThat(decision.getTradePlanId()).isEqualTo(55L);
        assertThat(decision.isPaper()).isTrue();
        assertThat(decision.getNormalizedPlan()).contains("\"quantity\":\"0.002\"");

        ArgumentCaptor<NormalizedPlan> plan = ArgumentCaptor.forClass(NormalizedPlan.class);
        verify(executionService).execute(plan.capture(), eq(4L), eq(decision.getClientOrderId()), eq(true),
                eq(adapter), eq(new BigDecimal("50000")));
        assertThat(plan.getValue().tpPrice()).isEqualByComparingTo("51000");
    }

    @Test
    void executionExceptionFailsDecision() {
        modelReturns(String.format(OPEN_PLAN, 5));
        when(executionService.execute(any(), any(), any(), anyBoolean(), any(), any()))
                .thenThrow(new IllegalStateException("database unavailable"));

        process();

        DecisionLog decision = lastSavedDecision();
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.FAILED);
        assertThat(decision.getExecutionError()).isEqualTo("database unavailable");
    }

    @Test
    void runCycleProcessesSignalsAndClosesAdapter() {
        stubTraderGraph();
        modelReturns(skipPlan());

        CycleReport report = service.runCycle(1L);

        assertThat(report.lockAcquired()).isTrue();
        assertThat(report.decisionIds()).containsExactly(100L);
        verify(adapter).close();
    }

    @Test
    void heldLockSkipsCycle() {
        StoreBackedMutex other = new StoreBackedMutex(lockStore, "trader:1:cycle", Duration.ofSeconds(60),
                Duration.ofMillis(5));
        other.tryAcquire();

        CycleReport report = service.runCycle(1L);

        assertThat(report.lockAcquired()).isFalse();
        verify(traderRepository, never()).findByIdAndEnabledTrue(any());
    }

    @Test
    void unknownModelProviderFailsCycle() {
        stubTraderGraph();
        modelConfig.setProvider("mistral");

        assertThatThrownBy(() -> service.runCycle(1L))
                .hasMessageContaining("mistral");
        verify(adapterFactory, never()).create(any(ExchangeAccount.class));
    }

    @Test
    void signalAlreadyDecidedForTraderIsSkippedBeforeInsert() {
        when(decisionLogRepository.existsByTraderIdAndSignalId(1L, 42L)).thenReturn(true);

        assertThat(process()).isNull();

        verify(decisionLogRepository, never()).save(any(DecisionLog.class));
        verify(modelRouter, never()).generate(any(), any(), anyString(), anyString(), any());
    }

    @Test
    void longCycleKeepsTraderLockBetweenSignals() {
        stubTraderGraph();
        when(signalRepository.findUnconsumed(eq(2L), eq(1L), any(Pageable.class))).thenReturn(signals(5));
        List<Boolean> otherWorkerAcquired = new ArrayList<>();
        when(modelRouter.generate(any(), any(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            lockClock.advance(Duration.ofSeconds(30));
            otherWorkerAcquired.add(mutexFactory.traderCycle(1L).tryAcquire());
            return ModelResponse.success(skipPlan(), Map.of("total_tokens", 20));
        });

        CycleReport report = service.runCycle(1L);

        assertThat(otherWorkerAcquired).containsExactly(false, false, false, false, false);
        assertThat(report.decisionIds()).hasSize(5);
    }

    @Test
    void lostTraderLockStopsRemainingSignals() {
        stubTraderGraph();
        when(signalRepository.findUnconsumed(eq(2L), eq(1L), any(Pageable.class))).thenReturn(signals(3));
        when(modelRouter.generate(any(), any(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            lockClock.advance(Duration.ofSeconds(61));
            assertThat(mutexFactory.traderCycle(1L).tryAcquire()).isTrue();
            return ModelResponse.success(skipPlan(), Map.of("total_tokens", 20));
        });

        CycleReport report = service.runCycle(1L);

        assertThat(report.decisionIds()).hasSize(1);
        verify(modelRouter, times(1)).generate(any(), any(), anyString(), anyString(), any());
        verify(adapter).close();
    }

    @Test
    void undecryptableCredentialsFailTraderWithoutThrowing() {
        stubTraderGraph();
        when(adapterFactory.create(account)).thenThrow(new SecretsException("Failed to decrypt secret"));

        CycleReport report = service.runCycle(1L);

        assertThat(report.lockAcquired()).isTrue();
        assertThat(report.decisionIds()).isEmpty();
        assertThat(report.error()).isEqualTo("Exchange credentials unusable for account 4");
        assertThat(meterRegistry.counter("trader_cycles_total", "status", "failed").count()).isEqualTo(1.0);
        verify(modelRouter, never()).generate(any(), any(), anyString(), anyString(), any());
        assertThat(mutexFactory.traderCycle(1L).tryAcquire()).isTrue();
    }

    @Test
    void runAllTradersDispatchesEnabledTraders() {
        when(traderRepository.findByEnabledTrue()).thenReturn(List.of(trader));
        when(traderRepository.findByIdAndEnabledTrue(1L)).thenReturn(Optional.empty());

        assertThat(service.runAllTraders()).isEqualTo(1);
        verify(traderRepository).findByIdAndEnabledTrue(1L);
    }

    private Long process() {
        return service.processSignal(trader, null, account, modelConfig, true, signal, adapter);
    }

    private List<Signal> signals(int count) {
        List<Signal> batch = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            batch.add(Signal.builder()
                    .id(42L + i).strategyId(2L).symbol("BTCUSDT").timeframe("1h").side("long")
                    .score(new BigDecimal("0.9")).reasonSummary("RSI breakout").build());
        }
        return batch;
    }

    private void stubTraderGraph() {
        when(traderRepository.findByIdAndEnabledTrue(1L)).thenReturn(Optional.of(trader));
        when(signalRepository.findUnconsumed(eq(2L), eq(1L), any(Pageable.class))).thenReturn(List.of(signal));
        when(accountRepository.findById(4L)).thenReturn(Optional.of(account));
        when(modelConfigRepository.findById(3L)).thenReturn(Optional.of(modelConfig));
        when(strategyRepository.findById(2L)).thenReturn(Optional.empty());
        when(adapterFactory.create(account)).thenReturn(adapter);
    }

    private void modelReturns(String content) {
        when(modelRouter.generate(any(), any(), anyString(), anyString(), any()))
                .thenReturn(ModelResponse.success(content, Map.of("total_tokens", 20)));
    }

    private static String skipPlan() {
        return "{\"action\":\"skip\",\"confidence\":0.4,\"reason_summary\":\"Quiet market\"}";
    }

    private DecisionLog lastSavedDecision() {
        ArgumentCaptor<DecisionLog> captor = ArgumentCaptor.forClass(DecisionLog.class);
        verify(decisionLogRepository, atLeastOnce()).save(captor.capture());
        List<DecisionLog> saved = captor.getAllValues();
        return saved.get(saved.size() - 1);
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
