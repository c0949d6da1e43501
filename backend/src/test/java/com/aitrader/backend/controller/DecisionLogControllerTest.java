package com.aitrader.backend.controller;

import com.aitrader.backend.model.DecisionLog;
import com.aitrader.backend.model.DecisionStatus;
import com.aitrader.backend.repository.DecisionLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DecisionLogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DecisionLogRepository decisionLogRepository;

    private Long liveId;

    @BeforeEach
    void setup() {
        decisionLogRepository.deleteAll();
        LocalDateTime base = LocalDateTime.of(2024, 3, 1, 10, 0);
        decisionLogRepository.save(DecisionLog.builder()
                .traderId(1L).clientOrderId("T-paper").status(DecisionStatus.BLOCKED)
                .riskAllowed(false).riskReasons("[\"Leverage 20 exceeds max 10\"]")
                .paper(true).createdAt(base).build());
        liveId = decisionLogRepository.save(DecisionLog.builder()
                .traderId(1L).clientOrderId("T-live").status(DecisionStatus.EXECUTED)
                .riskAllowed(true).tradePlan("{\"action\":\"open\"}")
                .paper(false).createdAt(base.plusMinutes(1)).build()).getId();
    }

    @Test
    void listsDecisionsFilteredByMode() throws Exception {
        mockMvc.perform(get("/api/logs/decisions").param("isPaper", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].clientOrderId").value("T-paper"))
                .andExpect(jsonPath("$[0].status").value("blocked"))
                .andExpect(jsonPath("$[0].isPaper").value(true))
                .andExpect(jsonPath("$[0].riskReasons[0]").value("Leverage 20 exceeds max 10"));
    }

    @Test
    void singleDecisionCarriesPlanPayload() throws Exception {
        mockMvc.perform(get("/api/logs/decisions/" + liveId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tradePlan.action").value("open"))
                .andExpect(jsonPath("$.isPaper").value(false));
    }

    @Test
    void missingDecisionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/logs/decisions/999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void badQueryParametersAreRejected() throws Exception {
        mockMvc.perform(get("/api/logs/decisions").param("limit", "500"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/logs/decisions").param("status", "exploded"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown decision status: exploded"));
    }

    @Test
    void statsSplitByOutcomeAndMode() throws Exception {
        mockMvc.perform(get("/api/logs/stats").param("traderId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.executed").value(1))
                .andExpect(jsonPath("$.blocked").value(1))
                .andExpect(jsonPath("$.paper").value(1))
                .andExpect(jsonPath("$.live").value(1));
    }
}
