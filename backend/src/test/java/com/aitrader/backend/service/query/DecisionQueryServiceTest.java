package com.aitrader.backend.service.query;

import com.aitrader.backend.dto.DecisionLogDto;
import com.aitrader.backend.dto.DecisionStatsDto;
import com.aitrader.backend.exception.NotFoundException;
import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.repository.DecisionLogRepository;
import com.aitrader.backend.repository.TradePlanRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DecisionQueryServiceTest {

    private DecisionLogRepository decisionLogRepository;
    private TradePlanRepository tradePlanRepository;
    private DecisionQueryService service;

    @BeforeEach
    void setUp() {
        decisionLogRepository = mock(DecisionLogRepository.class);
        tradePlanRepository = mock(TradePlanRepository.class);
        service = new DecisionQueryService(decisionLogRepository, tradePlanRepository, new ObjectMapper());
    }

    @Test
    void listDecisionsPassesFiltersAndOffset() {
        DecisionLog blocked = DecisionLog.builder()
                .id(5L).traderId(1L).clientOrderId("T-1").status(DecisionStatus.BLOCKED)
                .riskAllowed(false).riskReasons("[\"Leverage 20 exceeds max 10\"]").paper(true).build();
        when(decisionLogRepository.search(eq(1L), eq(DecisionStatus.BLOCKED), isNull(), any()))
                .thenReturn(List.of(blocked));

        List<DecisionLogDto> result = service.listDecisions(1L, "blocked", null, 20, 40);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getStatus()).isEqualTo("blocked");
        assertThat(result.get(0).getRiskReasons()).containsExactly("Leverage 20 exceeds max 10");
        assertThat(result.get(0).isPaper()).isTrue();

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(decisionLogRepository).search(eq(1L), eq(DecisionStatus.BLOCKED), isNull(), page.capture());
        assertThat(page.getValue().getOffset()).isEqualTo(40);
        assertThat(page.getValue().getPageSize()).isEqualTo(20);
    }

    @Test
    void limitOutsideRangeIsRejected() {
        assertThatThrownBy(() -> service.listDecisions(null, null, null, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.listDecisions(null, null, null, 201, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("200");
        verifyNoInteractions(decisionLogRepository);
    }

    @Test
    void unknownStatusIsRejected() {
        assertThatThrownBy(() -> service.listDecisions(null, "exploded", null, 10, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exploded");
        assertThatThrownBy(() -> service.listTradePlans(null, "exploded", null, 10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getDecisionExpandsJsonColumns() {
        DecisionLog decision = DecisionLog.builder()
                .id(7L).traderId(1L).clientOrderId("T-7").status(DecisionStatus.EXECUTED)
                .confidence(new BigDecimal("0.80"))
                .tradePlan("{\"action\":\"open\",\"symbol\":\"BTCUSDT\"}")
                .normalizedPlan("{\"quantity\":\"0.002\"}")
                .paper(false).build();
        when(decisionLogRepository.findById(7L)).thenReturn(Optional.of(decision));

        DecisionLogDto dto = service.getDecision(7L);

        assertThat(dto.getTradePlan().get("symbol").asText()).isEqualTo("BTCUSDT");
        assertThat(dto.getNormalizedPlan().get("quantity").asText()).isEqualTo("0.002");
        assertThat(dto.getInputSnapshot()).isNull();
        assertThat(dto.getRiskReasons()).isNull();
        assertThat(dto.isPaper()).isFalse();
    }

    @Test
    void missingDecisionIsNotFound() {
        when(decisionLogRepository.findById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getDecision(8L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void statsCountEachBucket() {
        when(decisionLogRepository.countFiltered(1L, null, null)).thenReturn(10L);
        when(decisionLogRepository.countFiltered(1L, DecisionStatus.EXECUTED, null)).thenReturn(4L);
        when(decisionLogRepository.countFiltered(1L, DecisionStatus.BLOCKED, null)).thenReturn(3L);
        when(decisionLogRepository.countFiltered(1L, DecisionStatus.FAILED, null)).thenReturn(1L);
        when(decisionLogRepository.countFiltered(1L, null, true)).thenReturn(8L);
        when(decisionLogRepository.countFiltered(1L, null, false)).thenReturn(2L);

        assertThat(service.stats(1L)).isEqualTo(new DecisionStatsDto(10, 4, 3, 1, 8, 2));
    }
}
