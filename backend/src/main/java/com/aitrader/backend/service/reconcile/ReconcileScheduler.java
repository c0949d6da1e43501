package com.aitrader.backend.service.reconcile;

import com.aitrader.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reconcile.enabled", havingValue = "true", matchIfMissing = true)
public class ReconcileScheduler {

    private final ReconciliationService reconciliationService;
    private final ScheduledTaskGuard guard;

    @Scheduled(fixedDelayString = "${reconcile.interval-seconds:300}000")
    public void runReconcile() {
        guard.run("reconcile_all", reconciliationService::reconcileAllAccounts);
    }
}
