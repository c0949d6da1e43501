package com.aitrader.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Decision log view. The payload fields (input snapshot, plan, evidence, normalized plan)
 * are only filled in the single-decision view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DecisionLogDto {

    private Long id;
    private Long traderId;
    private Long signalId;
    private String clientOrderId;
    private String status;
    private BigDecimal confidence;
    private String reasonSummary;
    private Boolean riskAllowed;
    private List<String> riskReasons;
    private Long tradePlanId;
    private String executionError;
    private String modelProvider;
    private String modelName;
    private Integer tokensUsed;
    @JsonProperty("isPaper")
    private boolean paper;
    private LocalDateTime createdAt;

    private JsonNode inputSnapshot;
    private JsonNode tradePlan;
    private JsonNode evidence;
    private JsonNode normalizedPlan;
}
