package com.rebalancr.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record AutoRebalanceRequest(
        String frequency,
        @DecimalMin("0.1") @DecimalMax("5.0") Double maxSlippage
) {
}
