package com.rebalancr.backend.dto;

import java.time.Instant;

/**
 * Partial update of portfolio settings; null fields are left unchanged.
 */
public record PortfolioUpdate(
        Boolean autoRebalance,
        Double maxSlippage,
        Long checkInterval,
        Instant lastRebalanceTimestamp
) {
}
