package com.rebalancr.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record RebalanceRequest(
        boolean dryRun,
        @DecimalMin("0.1") @DecimalMax("5.0") Double maxSlippagePercent
) {
}
