package com.aitrader.backend.controller;

import com.aitrader.backend.dto.ReplayChain;
import com.aitrader.backend.dto.SignalReplay;
import com.aitrader.backend.service.query.ReplayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/replay")
@RequiredArgsConstructor
@Tag(name = "Replay")
public class ReplayController {

    private final ReplayService replayService;

    @GetMapping("/decision/{id}")
    @Operation(summary = "Chain from signal to executions for a decision")
    public ResponseEntity<ReplayChain> decision(@PathVariable Long id) {
        return ResponseEntity.ok(replayService.replayDecision(id));
    }

    @GetMapping("/trade/{id}")
    @Operation(summary = "Chain traced back from a trade plan")
    public ResponseEntity<ReplayChain> trade(@PathVariable Long id) {
        return ResponseEntity.ok(replayService.replayTrade(id));
    }

    @GetMapping("/signal/{id}")
    @Operation(summary = "A signal and every decision made on it")
    public ResponseEntity<SignalReplay> signal(@PathVariable Long id) {
        return ResponseEntity.ok(replayService.replaySignal(id));
    }
}
