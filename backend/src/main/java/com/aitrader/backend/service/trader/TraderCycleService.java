package com.aitrader.backend.service.trader;

import com.aitrader.backend.config.TraderProperties;
import com.aitrader.backend.exception.SecretsException;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.model.ExchangeAccount;
import com.aitrader.backend.model.MarketSnapshot;
import com.aitrader.backend.model.ModelConfig;
import com.aitrader.backend.model.Signal;
import com.aitrader.backend.model.Strategy;
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
import com.aitrader.backend.service.ai.ModelProvider;
import com.aitrader.backend.service.ai.ModelResponse;
import com.aitrader.backend.service.ai.ModelRouter;
import com.aitrader.backend.service.exchange.ExchangeAdapter;
import com.aitrader.backend.service.exchange.ExchangeAdapterFactory;
import com.aitrader.backend.service.lock.DistributedMutex;
import com.aitrader.backend.service.lock.MutexFactory;
import com.aitrader.backend.service.plan.PromptBuilder;
import com.aitrader.backend.service.plan.TradePlanSchema;
import com.aitrader.backend.service.plan.TradePlanOutput;
import com.aitrader.backend.service.plan.TradePlanValidator;
import com.aitrader.backend.service.plan.ValidationResult;
import com.aitrader.backend.service.risk.AccountState;
import com.aitrader.backend.service.risk.ClientOrderIds;
import com.aitrader.backend.service.risk.RiskManager;
import com.aitrader.backend.service.risk.RiskProfile;
import com.aitrader.backend.service.risk.RiskProfileFactory;
import com.aitrader.backend.service.risk.RiskReport;
import com.aitrader.backend.util.OhlcvUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * One trading cycle per trader: pull unconsumed signals, ask the model for a plan, gate it
 * through risk and execute it. Each signal is committed on its own so a failure only loses
 * the signal in flight.
 */
@Service
@Slf4j
public class TraderCycleService {

    private static final String MDC_TRADER = "traderId";
    private static final String MDC_SYMBOL = "symbol";

    private final TraderRepository traderRepository;
    private final SignalRepository signalRepository;
    private final MarketSnapshotRepository snapshotRepository;
    private final StrategyRepository strategyRepository;
    private final ExchangeAccountRepository accountRepository;
    private final ModelConfigRepository modelConfigRepository;
    private final DecisionLogRepository decisionLogRepository;
    private final ExchangeAdapterFactory adapterFactory;
    private final ModelRouter modelRouter;
    private final PromptBuilder promptBuilder;
    private final TradePlanSchema tradePlanSchema;
    private final TradePlanValidator validator;
    private final RiskManager riskManager;
    private final RiskProfileFactory riskProfileFactory;
    private final AccountStateService accountStateService;
    private final TradeExecutionService executionService;
    private final MutexFactory mutexFactory;
    private final MetricsService metricsService;
    private final TraderProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor tradingExecutor;
    private final Clock clock;

    public TraderCycleService(TraderRepository traderRepository,
                              SignalRepository signalRepository,
                              MarketSnapshotRepository snapshotRepository,
                              StrategyRepository strategyRepository,
                              ExchangeAccountRepository accountRepository,
                              ModelConfigRepository modelConfigRepository,
                              DecisionLogRepository decisionLogRepository,
                              ExchangeAdapterFactory adapterFactory,
                              ModelRouter modelRouter,
                              PromptBuilder promptBuilder,
                              TradePlanSchema tradePlanSchema,
                              TradePlanValidator validator,
                              RiskManager riskManager,
                              RiskProfileFactory riskProfileFactory,
                              AccountStateService accountStateService,
                              TradeExecutionService executionService,
                              MutexFactory mutexFactory,
                              MetricsService metricsService,
                              TraderProperties properties,
                              ObjectMapper objectMapper,
                              @Qualifier("tradingExecutor") Executor tradingExecutor,
                              Clock clock) {
        this.traderRepository = traderRepository;
        this.signalRepository = signalRepository;
        this.snapshotRepository = snapshotRepository;
        this.strategyRepository = strategyRepository;
        this.accountRepository = accountRepository;
        this.modelConfigRepository = modelConfigRepository;
        this.decisionLogRepository = decisionLogRepository;
        this.adapterFactory = adapterFactory;
        this.modelRouter = modelRouter;
        this.promptBuilder = promptBuilder;
        this.tradePlanSchema = tradePlanSchema;
        this.validator = validator;
        this.riskManager = riskManager;
        this.riskProfileFactory = riskProfileFactory;
        this.accountStateService = accountStateService;
        this.executionService = executionService;
        this.mutexFactory = mutexFactory;
        this.metricsService = metricsService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.tradingExecutor = tradingExecutor;
        this.clock = clock;
    }

    /**
     * Hands every enabled trader to the trading pool. Each unit takes its own trader lock.
     */
    public int runAllTraders() {
        List<Trader> traders = traderRepository.findByEnabledTrue();
        for (Trader trader : traders) {
            Long traderId = trader.getId();
            tradingExecutor.execute(() -> {
                try {
                    runCycle(traderId);
                } catch (RuntimeException e) {
                    // already logged and counted by runCycle
                    log.debug("Cycle for trader {} ended with {}", traderId, e.toString());
                }
            });
        }
        log.info("Dispatched {} trader cycles", traders.size());
        return traders.size();
    }

    /**
     * Runs one cycle under the trader's mutex. Contention is a normal outcome and yields a
     * skipped report. The lock is extended before each signal and the cycle stops once it is lost.
     * Undecryptable exchange credentials fail only this trader.
     */
    public CycleReport runCycle(Long traderId) {
        MDC.put(MDC_TRADER, String.valueOf(traderId));
        try (DistributedMutex mutex = mutexFactory.traderCycle(traderId)) {
            if (!mutex.acquireBlocking(mutexFactory.blockingTimeout())) {
                log.info("Skipping trader cycle, lock held elsewhere event=lock_contention trader={}", traderId);
                metricsService.recordTraderCycle("skipped");
                return CycleReport.skipped(traderId);
            }
            CycleReport report = processTrader(traderId, mutex);
            metricsService.recordTraderCycle(report.error() == null ? "success" : "failed");
            return report;
        } catch (RuntimeException e) {
            log.error("Trader cycle failed event=cycle_error trader={}", traderId, e);
            metricsService.recordTraderCycle("failed");
            throw e;
        } finally {
            MDC.remove(MDC_TRADER);
        }
    }

    private CycleReport processTrader(Long traderId, DistributedMutex mutex) {
        Trader trader = traderRepository.findByIdAndEnabledTrue(traderId).orElse(null);
        if (trader == null) {
            log.debug("Trader {} missing or disabled", traderId);
            return CycleReport.completed(traderId, List.of());
        }

        List<Signal> signals = signalRepository.findUnconsumed(trader.getStrategyId(), trader.getId(),
                PageRequest.of(0, properties.getSignalBatchSize()));
        if (signals.isEmpty()) {
            return CycleReport.completed(traderId, List.of());
        }

        ExchangeAccount account = accountRepository.findById(trader.getExchangeAccountId())
                .orElseThrow(() -> new IllegalStateException("Exchange account " + trader.getExchangeAccountId()
                        + " not found for trader " + trader.getId()));
        ModelConfig modelConfig = modelConfigRepository.findById(trader.getModelConfigId())
                .orElseThrow(() -> new IllegalStateException("Model config " + trader.getModelConfigId()
                        + " not found for trader " + trader.getId()));
        // unknown provider is a configuration error for the whole trader
        ModelProvider.fromString(modelConfig.getProvider());
        Strategy strategy = strategyRepository.findById(trader.getStrategyId()).orElse(null);
        boolean paper = trader.getMode() == TraderMode.PAPER || properties.isPaperTrading();

        ExchangeAdapter adapter;
        try {
            adapter = adapterFactory.create(account);
        } catch (SecretsException e) {
            log.error("Exchange credentials unusable event=adapter_error trader={} account={}: {}",
                    traderId, account.getId(), e.getMessage());
            return CycleReport.failed(traderId, "Exchange credentials unusable for account " + account.getId());
        }

        List<Long> decisionIds = new ArrayList<>();
        try (adapter) {
            for (int i = 0; i < signals.size(); i++) {
                if (!mutex.extend(mutexFactory.traderCycleTtl())) {
                    log.warn("Trader lock lost event=lock_lost trader={}, leaving {} signals for the next cycle",
                            traderId, signals.size() - i);
                    break;
                }
                Signal signal = signals.get(i);
                try {
                    Long decisionId = processSignal(trader, strategy, account, modelConfig, paper, signal, adapter);
                    if (decisionId != null) {
                        decisionIds.add(decisionId);
                    }
                } catch (RuntimeException e) {
                    log.error("Signal {} failed for trader {}", signal.getId(), trader.getId(), e);
                } finally {
                    MDC.remove(MDC_SYMBOL);
                }
            }
        }
        return CycleReport.completed(traderId, decisionIds);
    }

    /**
     * @return id of the decision written, or null when the signal was a duplicate
     */
    Long processSignal(Trader trader, Strategy strategy, ExchangeAccount account, ModelConfig modelConfig,
                       boolean paper, Signal signal, ExchangeAdapter adapter) {
        String clientOrderId = ClientOrderIds.generate(trader.getId(), signal.getId(), clock.instant());
        if (decisionLogRepository.existsByClientOrderId(clientOrderId)) {
            log.info("Duplicate cycle for signal {} clientOrderId={}, skipping", signal.getId(), clientOrderId);
            return null;
        }
        MDC.put(MDC_SYMBOL, signal.getSymbol());

        Map<String, Object> marketData = marketData(signal);
        BigDecimal currentPrice = currentPrice(adapter, signal.getSymbol());
        RiskProfile riskProfile = riskProfileFactory.build(trader, strategy);
        AccountState accountState = accountStateService.build(adapter, trader.getId());

        Map<String, Object> signalData = new LinkedHashMap<>();
        signalData.put("symbol", signal.getSymbol());
        signalData.put("side", signal.getSide());
        signalData.put("score", signal.getScore());
        signalData.put("timeframe", signal.getTimeframe());
        signalData.put("reason", signal.getReasonSummary());
        Map<String, Object> riskData = riskProfile.toPromptData();
        Map<String, Object> accountData = accountState.toPromptData();

        Map<String, Object> inputSnapshot = new LinkedHashMap<>();
        inputSnapshot.put("signal", signalData);
        inputSnapshot.put("market", marketData);
        inputSnapshot.put("risk", riskData);
        inputSnapshot.put("account", accountData);

        if (decisionLogRepository.existsByTraderIdAndSignalId(trader.getId(), signal.getId())) {
            log.info("Signal {} already decided for trader {}, skipping", signal.getId(), trader.getId());
            return null;
        }
        DecisionLog decision;
        try {
            decision = decisionLogRepository.save(DecisionLog.builder()
                    .traderId(trader.getId())
                    .signalId(signal.getId())
                    .clientOrderId(clientOrderId)
                    .status(DecisionStatus.PENDING)
                    .inputSnapshot(toJson(inputSnapshot))
                    .modelProvider(modelConfig.getProvider())
                    .modelName(modelConfig.getModelName())
                    .paper(paper)
                    .build());
        } catch (DataIntegrityViolationException e) {
            // another worker claimed the same key between the check and the insert
            log.info("Decision for clientOrderId={} already written, skipping", clientOrderId);
            return null;
        }

        try {
            decision = decide(decision, trader, account, modelConfig, paper, adapter, currentPrice, riskProfile,
                    accountState, promptBuilder.build(signalData, marketData, riskData, accountData));
        } catch (RuntimeException e) {
            log.error("Decision {} failed unexpectedly", decision.getId(), e);
            decision.setStatus(DecisionStatus.FAILED);
            decision.setExecutionError(TradeExecutionService.truncate(describe(e)));
            decision = decisionLogRepository.save(decision);
        }
        return decision.getId();
    }

    private DecisionLog decide(DecisionLog decision, Trader trader, ExchangeAccount account, ModelConfig modelConfig,
                               boolean paper, ExchangeAdapter adapter, BigDecimal currentPrice,
                               RiskProfile riskProfile, AccountState accountState, PromptBuilder.Prompt prompt) {
        JsonNode schema = properties.isStructuredOutput() ? tradePlanSchema.get() : null;
        ModelResponse response = modelRouter.generate(modelConfig, trader.getId(), prompt.system(), prompt.user(), schema);
        if (!response.success()) {
            log.warn("Model call failed type={} message={}", response.errorType(), response.errorMessage());
            decision.setStatus(DecisionStatus.FAILED);
            decision.setExecutionError("AI error: " + response.errorType().getValue());
            return decisionLogRepository.save(decision);
        }
        decision.setTokensUsed(response.totalTokens());

        ValidationResult validation = validator.validate(response.content());
        if (!validation.valid()) {
            log.warn("Model output rejected: {}", validation.errors());
            decision.setStatus(DecisionStatus.FAILED);
            decision.setExecutionError(String.join("; ", validation.errors()));
            return decisionLogRepository.save(decision);
        }

        TradePlanOutput plan = validation.plan();
        Map<String, Object> planSummary = new LinkedHashMap<>();
        planSummary.put("action", plan.getAction().getValue());
        planSummary.put("symbol", plan.getSymbol());
        planSummary.put("side", plan.getSide() == null ? null : plan.getSide().getValue());
        planSummary.put("leverage", plan.getLeverage());
        planSummary.put("confidence", plan.getConfidence());
        decision.setTradePlan(toJson(planSummary));
        decision.setConfidence(plan.getConfidence());
        decision.setReasonSummary(plan.getReasonSummary());
        decision.setEvidence(plan.getEvidence() == null ? null : toJson(plan.getEvidence()));

        if (plan.getAction() == TradePlanOutput.Action.SKIP) {
            decision.setStatus(DecisionStatus.ALLOWED);
            decision.setRiskAllowed(true);
            decision.setRiskReasons(toJson(List.of("Action is skip")));
            return decisionLogRepository.save(decision);
        }

        RiskReport report = riskManager.check(plan, riskProfile, accountState, currentPrice);
        metricsService.recordRiskCheck(report.allowed());
        decision.setRiskAllowed(report.allowed());
        decision.setRiskReasons(toJson(report.reasons()));
        if (!report.allowed()) {
            log.info("Plan blocked by risk: {}", report.reasons());
            decision.setStatus(DecisionStatus.BLOCKED);
            return decisionLogRepository.save(decision);
        }

        if (report.normalizedPlan() == null) {
            // close: nothing to open
            decision.setStatus(DecisionStatus.ALLOWED);
            return decisionLogRepository.save(decision);
        }

        decision.setNormalizedPlan(toJson(report.normalizedPlan().toRecord()));
        decision = decisionLogRepository.save(decision);
        try {
            TradePlan tradePlan = executionService.execute(report.normalizedPlan(), account.getId(),
                    decision.getClientOrderId(), paper, adapter, currentPrice);
            decision.setTradePlanId(tradePlan.getId());
            decision.setStatus(tradePlan.getStatus() == TradePlanStatus.FAILED
                    ? DecisionStatus.FAILED : DecisionStatus.EXECUTED);
            if (tradePlan.getErrorMessage() != null) {
                decision.setExecutionError(tradePlan.getErrorMessage());
            }
        } catch (RuntimeException e) {
            log.error("Execution failed for clientOrderId={}", decision.getClientOrderId(), e);
            decision.setStatus(DecisionStatus.FAILED);
            decision.setExecutionError(TradeExecutionService.truncate(describe(e)));
        }
        return decisionLogRepository.save(decision);
    }

    private Map<String, Object> marketData(Signal signal) {
        Map<String, Object> market = new LinkedHashMap<>();
        if (signal.getSnapshotId() == null) {
            return market;
        }
        MarketSnapshot snapshot = snapshotRepository.findById(signal.getSnapshotId()).orElse(null);
        if (snapshot == null) {
            return market;
        }
        market.put("symbol", snapshot.getSymbol());
        market.put("timeframe", snapshot.getTimeframe());
        market.put("ohlcv", OhlcvUtils.tail(objectMapper, readTree(snapshot.getOhlcv()),
                properties.getSnapshotOhlcvPoints()));
        JsonNode indicators = readTree(snapshot.getIndicators());
        market.put("indicators", indicators == null ? objectMapper.createObjectNode() : indicators);
        return market;
    }

    private BigDecimal currentPrice(ExchangeAdapter adapter, String symbol) {
        try {
            return adapter.getTicker(symbol);
        } catch (RuntimeException e) {
            log.warn("Ticker unavailable for {}: {}", symbol, e.getMessage());
            return null;
        }
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable snapshot payload: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize decision payload", e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
