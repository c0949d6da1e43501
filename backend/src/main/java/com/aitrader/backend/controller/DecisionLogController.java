package com.aitrader.backend.controller;

import com.aitrader.backend.dto.DecisionLogDto;
import com.aitrader.backend.dto.DecisionStatsDto;
import com.aitrader.backend.dto.TradePlanDto;
import com.aitrader.backend.service.query.DecisionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/logs")
@RequiredArgsConstructor
@Validated
@Tag(name = "Decision Logs")
public class DecisionLogController {

    private final DecisionQueryService queryService;

    @GetMapping("/decisions")
    @Operation(summary = "List decision logs, newest first")
    public ResponseEntity<List<DecisionLogDto>> decisions(
            @RequestParam(required = false) Long traderId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Boolean isPaper,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return ResponseEntity.ok(queryService.listDecisions(traderId, status, isPaper, limit, offset));
    }

    @GetMapping("/decisions/{id}")
    @Operation(summary = "Get one decision with its input snapshot and plans")
    public ResponseEntity<DecisionLogDto> decision(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.getDecision(id));
    }

    @GetMapping("/executions")
    @Operation(summary = "List trade plans created by decisions")
    public ResponseEntity<List<TradePlanDto>> executions(
            @RequestParam(required = false) Long traderId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Boolean isPaper,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return ResponseEntity.ok(queryService.listTradePlans(traderId, status, isPaper, limit, offset));
    }

    @GetMapping("/stats")
    @Operation(summary = "Decision counts by outcome and mode")
    public ResponseEntity<DecisionStatsDto> stats(@RequestParam(required = false) Long traderId) {
        return ResponseEntity.ok(queryService.stats(traderId));
    }
}
