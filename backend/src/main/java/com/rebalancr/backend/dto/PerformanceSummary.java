package com.rebalancr.backend.dto;

import java.time.Instant;
import java.util.Map;

public record PerformanceSummary(
        Long portfolioId,
        int days,
        Instant from,
        long totalEvents,
        Map<String, Long> eventsByType,
        long executedRebalances,
        long ordersSucceeded,
        long ordersFailed,
        double tradedValue,
        Instant lastExecutedAt
) {
}
