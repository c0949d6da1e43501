package com.aitrader.backend.service.query;

import com.aitrader.backend.dto.ReplayChain;
import com.aitrader.backend.dto.ReplayStep;
import com.aitrader.backend.dto.SignalReplay;
import com.aitrader.backend.exception.NotFoundException;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.Execution;
import com.aitrader.backend.model.MarketSnapshot;
import com.aitrader.backend.model.Signal;
import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.repository.DecisionLogRepository;
import com.aitrader.backend.repository.ExecutionRepository;
import com.aitrader.backend.repository.MarketSnapshotRepository;
import com.aitrader.backend.repository.SignalRepository;
import com.aitrader.backend.repository.TradePlanRepository;
import com.aitrader.backend.util.JsonColumns;
import com.aitrader.backend.util.OhlcvUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the audit chain signal, snapshot, decision, risk report, trade plan, executions.
 * Everything leaving here is sanitized: OHLCV is cut to the last few candles, error text is
 * capped and the model's raw output is never included.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReplayService {

    static final int OHLCV_POINTS = 5;
    static final int MAX_ERROR_LENGTH = 100;

    private final DecisionLogRepository decisionLogRepository;
    private final SignalRepository signalRepository;
    private final MarketSnapshotRepository snapshotRepository;
    private final TradePlanRepository tradePlanRepository;
    private final ExecutionRepository executionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReplayChain replayDecision(Long decisionId) {
        DecisionLog decision = decisionLogRepository.findById(decisionId)
                .orElseThrow(() -> new NotFoundException("Decision not found: " + decisionId));
        TradePlan plan = decision.getTradePlanId() == null ? null
                : tradePlanRepository.findById(decision.getTradePlanId()).orElse(null);
        return chain(decision, plan);
    }

    public ReplayChain replayTrade(Long tradePlanId) {
        TradePlan plan = tradePlanRepository.findById(tradePlanId)
                .orElseThrow(() -> new NotFoundException("Trade plan not found: " + tradePlanId));
        DecisionLog decision = decisionLogRepository.findByTradePlanId(tradePlanId).orElse(null);
        return chain(decision, plan);
    }

    public SignalReplay replaySignal(Long signalId) {
        Signal signal = signalRepository.findById(signalId)
                .orElseThrow(() -> new NotFoundException("Signal not found: " + signalId));
        MarketSnapshot snapshot = snapshotOf(signal);

        List<Map<String, Object>> decisions = new ArrayList<>();
        for (DecisionLog decision : decisionLogRepository.findBySignalId(signalId)) {
            TradePlan plan = decision.getTradePlanId() == null ? null
                    : tradePlanRepository.findById(decision.getTradePlanId()).orElse(null);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", decision.getId());
            data.put("trader_id", decision.getTraderId());
            data.put("status", decision.getStatus().getValue());
            data.put("confidence", plain(decision.getConfidence()));
            data.put("reason_summary", decision.getReasonSummary());
            data.put("risk_allowed", decision.getRiskAllowed());
            data.put("trade_plan_id", decision.getTradePlanId());
            data.put("trade_status", plan == null ? null : plan.getStatus().getValue());
            data.put("is_paper", decision.isPaper());
            decisions.add(data);
        }

        Map<String, Object> market = null;
        if (snapshot != null) {
            market = new LinkedHashMap<>();
            market.put("ohlcv_summary", ohlcvSummary(snapshot));
            market.put("indicators", indicators(snapshot));
        }
        return new SignalReplay(signalData(signal), market, decisions);
    }

    private ReplayChain chain(DecisionLog decision, TradePlan plan) {
        Signal signal = decision == null || decision.getSignalId() == null ? null
                : signalRepository.findById(decision.getSignalId()).orElse(null);
        MarketSnapshot snapshot = signal == null ? null : snapshotOf(signal);
        List<Execution> executions = plan == null ? List.of()
                : executionRepository.findByTradePlanIdOrderByCreatedAtAscIdAsc(plan.getId());

        List<ReplayStep> steps = new ArrayList<>();
        if (signal != null) {
            steps.add(new ReplayStep(1, "signal", signalData(signal)));
        }
        if (snapshot != null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", snapshot.getId());
            data.put("exchange", snapshot.getExchange());
            data.put("symbol", snapshot.getSymbol());
            data.put("timeframe", snapshot.getTimeframe());
            data.put("timestamp", snapshot.getTimestamp());
            data.put("ohlcv_summary", ohlcvSummary(snapshot));
            data.put("indicators", indicators(snapshot));
            steps.add(new ReplayStep(2, "market_snapshot", data));
        }
        if (decision != null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", decision.getId());
            data.put("trader_id", decision.getTraderId());
            data.put("client_order_id", decision.getClientOrderId());
            data.put("status", decision.getStatus().getValue());
            data.put("model_provider", decision.getModelProvider());
            data.put("model_name", decision.getModelName());
            data.put("confidence", plain(decision.getConfidence()));
            data.put("reason_summary", decision.getReasonSummary());
            data.put("evidence", json(decision.getEvidence()));
            data.put("trade_plan", json(decision.getTradePlan()));
            data.put("tokens_used", decision.getTokensUsed());
            data.put("is_paper", decision.isPaper());
            data.put("created_at", decision.getCreatedAt());
            steps.add(new ReplayStep(3, "ai_decision", data));

            Map<String, Object> risk = new LinkedHashMap<>();
            risk.put("allowed", decision.getRiskAllowed());
            JsonNode reasons = json(decision.getRiskReasons());
            risk.put("reasons", reasons == null ? objectMapper.createArrayNode() : reasons);
            risk.put("normalized_plan", json(decision.getNormalizedPlan()));
            steps.add(new ReplayStep(4, "risk_report", risk));
        }
        if (plan != null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", plan.getId());
            data.put("client_order_id", plan.getClientOrderId());
            data.put("symbol", plan.getSymbol());
            data.put("side", plan.getSide());
            data.put("quantity", plain(plan.getQuantity()));
            data.put("entry_price", plain(plan.getEntryPrice()));
            data.put("tp_price", plain(plan.getTpPrice()));
            data.put("sl_price", plain(plan.getSlPrice()));
            data.put("leverage", plain(plan.getLeverage()));
            data.put("status", plan.getStatus().getValue());
            data.put("is_paper", plan.isPaper());
            data.put("error_message", JsonColumns.truncate(plan.getErrorMessage(), MAX_ERROR_LENGTH));
            data.put("created_at", plan.getCreatedAt());
            steps.add(new ReplayStep(5, "trade_plan", data));
        }
        int step = 6;
        for (Execution execution : executions) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", execution.getId());
            data.put("order_type", execution.getOrderType().getValue());
            data.put("exchange_order_id", execution.getExchangeOrderId());
            data.put("client_order_id", execution.getClientOrderId());
            data.put("symbol", execution.getSymbol());
            data.put("side", execution.getSide());
            data.put("quantity", plain(execution.getQuantity()));
            data.put("filled_quantity", plain(execution.getFilledQuantity()));
            data.put("price", plain(execution.getPrice()));
            data.put("status", execution.getStatus().getValue());
            data.put("is_paper", execution.isPaper());
            data.put("error_message", JsonColumns.truncate(execution.getErrorMessage(), MAX_ERROR_LENGTH));
            data.put("created_at", execution.getCreatedAt());
            steps.add(new ReplayStep(step++, "execution", data));
        }
        return new ReplayChain(clock.instant(), steps);
    }

    private MarketSnapshot snapshotOf(Signal signal) {
        if (signal.getSnapshotId() == null) {
            return null;
        }
        return snapshotRepository.findById(signal.getSnapshotId()).orElse(null);
    }

    private Map<String, Object> signalData(Signal signal) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", signal.getId());
        data.put("strategy_id", signal.getStrategyId());
        data.put("symbol", signal.getSymbol());
        data.put("timeframe", signal.getTimeframe());
        data.put("side", signal.getSide());
        data.put("score", plain(signal.getScore()));
        data.put("reason_summary", signal.getReasonSummary());
        data.put("created_at", signal.getCreatedAt());
        return data;
    }

    private JsonNode ohlcvSummary(MarketSnapshot snapshot) {
        return OhlcvUtils.tail(objectMapper, json(snapshot.getOhlcv()), OHLCV_POINTS);
    }

    private JsonNode indicators(MarketSnapshot snapshot) {
        JsonNode indicators = json(snapshot.getIndicators());
        return indicators == null ? objectMapper.createObjectNode() : indicators;
    }

    private JsonNode json(String text) {
        return JsonColumns.read(objectMapper, text);
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }
}
