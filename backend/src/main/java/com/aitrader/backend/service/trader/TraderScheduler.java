package com.aitrader.backend.service.trader;

import com.aitrader.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "trader.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class TraderScheduler {

    private final TraderCycleService traderCycleService;
    private final ScheduledTaskGuard guard;

    @Scheduled(fixedDelayString = "${trader.scheduler.interval-seconds:60}000")
    public void runCycle() {
        guard.run("run_all_traders", traderCycleService::runAllTraders);
    }
}
