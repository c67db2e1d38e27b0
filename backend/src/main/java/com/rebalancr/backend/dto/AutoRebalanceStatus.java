package com.rebalancr.backend.dto;

import java.time.Instant;

public record AutoRebalanceStatus(
        Long portfolioId,
        boolean active,
        String frequency,
        long checkIntervalSeconds,
        long effectiveIntervalSeconds,
        double maxSlippage,
        Instant lastRebalanceTimestamp,
        Instant nextEligibleAt,
        String message
) {
}
