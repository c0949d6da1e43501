package com.aitrader.backend.service.query;

import com.aitrader.backend.dto.DecisionLogDto;
import com.aitrader.backend.dto.DecisionStatsDto;
import com.aitrader.backend.dto.TradePlanDto;
import com.aitrader.backend.exception.NotFoundException;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.model.TradePlanStatus;
import com.aitrader.backend.repository.DecisionLogRepository;
import com.aitrader.backend.repository.TradePlanRepository;
import com.aitrader.backend.util.JsonColumns;
import com.aitrader.backend.util.OffsetPageRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side over decisions and trade plans. The paper flag is carried on every view.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DecisionQueryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final DecisionLogRepository decisionLogRepository;
    private final TradePlanRepository tradePlanRepository;
    private final ObjectMapper objectMapper;

    /**
     * @param status decision status name, null for any
     * @throws IllegalArgumentException for an unknown status or a limit outside 1..200
     */
    public List<DecisionLogDto> listDecisions(Long traderId, String status, Boolean paper, int limit, int offset) {
        DecisionStatus statusFilter = status == null || status.isBlank() ? null : DecisionStatus.fromString(status);
        return decisionLogRepository.search(traderId, statusFilter, paper, page(limit, offset)).stream()
                .map(this::toSummary)
                .toList();
    }

    public DecisionLogDto getDecision(Long id) {
        DecisionLog decision = decisionLogRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Decision log not found: " + id));
        DecisionLogDto dto = toSummary(decision);
        dto.setInputSnapshot(JsonColumns.read(objectMapper, decision.getInputSnapshot()));
        dto.setTradePlan(JsonColumns.read(objectMapper, decision.getTradePlan()));
        dto.setEvidence(JsonColumns.read(objectMapper, decision.getEvidence()));
        dto.setNormalizedPlan(JsonColumns.read(objectMapper, decision.getNormalizedPlan()));
        return dto;
    }

    public List<TradePlanDto> listTradePlans(Long traderId, String status, Boolean paper, int limit, int offset) {
        TradePlanStatus statusFilter = status == null || status.isBlank() ? null : TradePlanStatus.fromString(status);
        return tradePlanRepository.search(traderId, statusFilter, paper, page(limit, offset)).stream()
                .map(DecisionQueryService::toDto)
                .toList();
    }

    public DecisionStatsDto stats(Long traderId) {
        return new DecisionStatsDto(
                decisionLogRepository.countFiltered(traderId, null, null),
                decisionLogRepository.countFiltered(traderId, DecisionStatus.EXECUTED, null),
                decisionLogRepository.countFiltered(traderId, DecisionStatus.BLOCKED, null),
                decisionLogRepository.countFiltered(traderId, DecisionStatus.FAILED, null),
                decisionLogRepository.countFiltered(traderId, null, true),
                decisionLogRepository.countFiltered(traderId, null, false));
    }

    private static OffsetPageRequest page(int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return new OffsetPageRequest(offset, limit);
    }

    private DecisionLogDto toSummary(DecisionLog decision) {
        return DecisionLogDto.builder()
                .id(decision.getId())
                .traderId(decision.getTraderId())
                .signalId(decision.getSignalId())
                .clientOrderId(decision.getClientOrderId())
                .status(decision.getStatus().getValue())
                .confidence(decision.getConfidence())
                .reasonSummary(decision.getReasonSummary())
                .riskAllowed(decision.getRiskAllowed())
                .riskReasons(reasons(decision.getRiskReasons()))
                .tradePlanId(decision.getTradePlanId())
                .executionError(decision.getExecutionError())
                .modelProvider(decision.getModelProvider())
                .modelName(decision.getModelName())
                .tokensUsed(decision.getTokensUsed())
                .paper(decision.isPaper())
                .createdAt(decision.getCreatedAt())
                .build();
    }

    private List<String> reasons(String json) {
        JsonNode node = JsonColumns.read(objectMapper, json);
        if (node == null) {
            return null;
        }
        return objectMapper.convertValue(node, STRING_LIST);
    }

    static TradePlanDto toDto(TradePlan plan) {
        return TradePlanDto.builder()
                .id(plan.getId())
                .clientOrderId(plan.getClientOrderId())
                .symbol(plan.getSymbol())
                .side(plan.getSide())
                .quantity(plan.getQuantity())
                .entryPrice(plan.getEntryPrice())
                .tpPrice(plan.getTpPrice())
                .slPrice(plan.getSlPrice())
                .leverage(plan.getLeverage())
                .status(plan.getStatus().getValue())
                .paper(plan.isPaper())
                .errorMessage(plan.getErrorMessage())
                .createdAt(plan.getCreatedAt())
                .updatedAt(plan.getUpdatedAt())
                .build();
    }
}
