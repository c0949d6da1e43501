package com.aitrader.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a failing scheduled task from killing its scheduler thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    public void run(String taskName, Runnable task) {
        long start = System.nanoTime();
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
        } finally {
            metricsService.recordJobDuration(taskName, start);
        }
    }
}
