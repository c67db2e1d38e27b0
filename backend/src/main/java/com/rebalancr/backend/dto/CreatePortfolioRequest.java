package com.rebalancr.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record CreatePortfolioRequest(
        @NotBlank String name,
        @DecimalMin("0.1") @DecimalMax("5.0") Double maxSlippage,
        @NotEmpty List<@Valid AssetEntry> assets
) {

    public record AssetEntry(
            @NotBlank String symbol,
            String tokenAddress,
            @PositiveOrZero double amount
    ) {
    }
}
