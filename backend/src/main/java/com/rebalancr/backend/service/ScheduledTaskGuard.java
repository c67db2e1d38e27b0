package com.rebalancr.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps one failing scheduled unit of work from escaping into the scheduler thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final RebalanceMetricsService metricsService;

    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (Exception e) {
            log.error("Scheduled task failed task={}", taskName, e);
            metricsService.recordTaskFailure(taskName);
            return false;
        }
    }
}
