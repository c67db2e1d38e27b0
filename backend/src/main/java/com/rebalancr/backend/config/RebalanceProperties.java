package com.rebalancr.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Configuration
@ConfigurationProperties(prefix = "rebalancr.rebalance")
@Data
@Validated
public class RebalanceProperties {

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Allocation allocation = new Allocation();

    @Valid
    private CostBenefit costBenefit = new CostBenefit();

    @Valid
    private Review review = new Review();

    @Valid
    private Monitor monitor = new Monitor();

    @Data
    public static class Scoring {
        @DecimalMin("0.0")
        private double sentimentWeight = 0.25;
        @DecimalMin("0.0")
        private double belowMedianWeight = 0.25;
        @DecimalMin("0.0")
        private double volatilityWeight = 0.25;
        @DecimalMin("0.0")
        private double trendWeight = 0.25;

        private double increaseThreshold = 0.3;
        private double decreaseThreshold = -0.3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double manipulationDampening = 0.5;

        // Below-median band: price mostly above its median scores positive.
        private double belowMedianLow = 0.4;
        private double belowMedianHigh = 0.6;

        private double volatilityLow = 0.3;
        private double volatilityHigh = 0.8;
    }

    @Data
    public static class Allocation {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxAdjustment = 0.2;

        @DecimalMin("0.0")
        private double minWeight = 0.05;

        @DecimalMax("1.0")
        private double maxWeight = 0.4;

        @NotEmpty
        private List<String> safeAssets = new ArrayList<>(List.of("USDC", "USDT", "DAI"));

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double safeAssetFloor = 0.2;

        @DecimalMin("0.0")
        private double minTradeFraction = 0.01;

        public boolean isSafeAsset(String symbol) {
            if (symbol == null) {
                return false;
            }
            String normalized = symbol.toUpperCase(Locale.ROOT);
            return safeAssets.stream().anyMatch(asset -> asset.equalsIgnoreCase(normalized));
        }
    }

    @Data
    public static class CostBenefit {
        @DecimalMin("0.0")
        private double tradingFeeRate = 0.001;

        @DecimalMin("0.0")
        private double gasEstimate = 10.0;

        @DecimalMin("0.0")
        private double slippageRate = 0.001;

        @NotNull
        private Duration minRebalanceInterval = Duration.ofDays(7);

        private double yieldDeltaEstimate = 0.0;

        @DecimalMin("0.0")
        private double improvementRate = 0.01;

        // Comfortable band: increases count below the ceiling, decreases above the floor.
        private double increaseBandCeiling = 0.4;
        private double decreaseBandFloor = 0.1;
    }

    @Data
    public static class Review {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minApprovalRate = 0.6;

        @DecimalMin("0.0")
        @DecimalMax("10.0")
        private double maxRisk = 7.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double highVolatilityThreshold = 0.7;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double directionalThreshold = 0.3;
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;

        @Positive
        private long intervalMs = 300_000;

        @Min(0)
        private long initialDelayMs = 60_000;

        private boolean executeTrades = false;
    }
}
