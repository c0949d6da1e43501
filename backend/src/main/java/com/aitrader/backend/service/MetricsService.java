package com.aitrader.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordTraderCycle(String status) {
        Counter.builder("trader_cycles_total")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordModelCall(String provider, String status) {
        Counter.builder("model_calls_total")
                .tag("provider", provider == null ? "unknown" : provider)
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordRiskCheck(boolean allowed) {
        Counter.builder("risk_checks_total")
                .tag("result", allowed ? "allowed" : "blocked")
                .register(meterRegistry)
                .increment();
    }

    public void recordExecution(String type, String status) {
        Counter.builder("executions_total")
                .tag("type", type)
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordReconcileRun(String status) {
        Counter.builder("reconcile_runs_total")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordReconcileUpdate(String type) {
        Counter.builder("reconcile_updates_total")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public void recordJobDuration(String task, long startNanos) {
        Timer.builder("worker_job_duration")
                .tag("task", task)
                .register(meterRegistry)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }
}
