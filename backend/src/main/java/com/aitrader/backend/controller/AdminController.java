package com.aitrader.backend.controller;

import com.aitrader.backend.service.reconcile.ReconcileReport;
import com.aitrader.backend.service.reconcile.ReconciliationService;
import com.aitrader.backend.service.trader.CycleReport;
import com.aitrader.backend.service.trader.TraderCycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin")
public class AdminController {

    private final TraderCycleService traderCycleService;
    private final ReconciliationService reconciliationService;

    @PostMapping("/traders/{id}/run")
    @Operation(summary = "Run one trader cycle now")
    public ResponseEntity<CycleReport> runTrader(@PathVariable Long id) {
        log.info("Manual trader cycle requested trader={}", id);
        return ResponseEntity.ok(traderCycleService.runCycle(id));
    }

    @PostMapping("/reconcile/{accountId}/run")
    @Operation(summary = "Reconcile one exchange account now")
    public ResponseEntity<ReconcileReport> runReconcile(@PathVariable Long accountId) {
        log.info("Manual reconciliation requested account={}", accountId);
        return ResponseEntity.ok(reconciliationService.reconcile(accountId));
    }
}
