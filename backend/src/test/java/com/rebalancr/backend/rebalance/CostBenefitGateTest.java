package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.model.RecommendedAction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class CostBenefitGateTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final CostBenefitGate gate = new CostBenefitGate(new RebalanceProperties());

    @Test
    void recentRebalanceIsTooFrequentWhateverTheBenefit() {
        PortfolioSnapshot snapshot = snapshot(100_000, NOW.minus(Duration.ofDays(1)), 3_600);
        TradePlan plan = new TradePlan(List.of(new TradeOrder("BTC", 0.1, 5_000, 50_000)));

        GateDecision decision = gate.evaluate(snapshot, plan,
                List.of(new ScoredAsset("BTC", 1.0, RecommendedAction.INCREASE)), NOW);

        assertThat(decision.proceed()).isFalse();
        assertThat(decision.reason()).isEqualTo(SkipReason.TOO_FREQUENT);
        assertThat(decision.message()).contains("too frequent").contains("2026-03-16T12:00:00Z");
    }

    @Test
    void longerCheckIntervalGovernsOverMinimum() {
        PortfolioSnapshot snapshot = snapshot(100_000, NOW.minus(Duration.ofDays(10)), 2_592_000);

        GateDecision decision = gate.evaluate(snapshot, TradePlan.empty(), List.of(), NOW);

        assertThat(decision.reason()).isEqualTo(SkipReason.TOO_FREQUENT);
        assertThat(gate.effectiveInterval(2_592_000)).isEqualTo(Duration.ofDays(30));
        assertThat(gate.effectiveInterval(3_600)).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void neverRebalancedPortfolioPassesIntervalCheck() {
        assertThat(gate.intervalElapsed(null, 86_400, NOW)).isTrue();
        assertThat(gate.nextEligibleAt(null, 86_400)).isNull();
        assertThat(gate.intervalElapsed(NOW.minus(Duration.ofDays(7)), 86_400, NOW)).isTrue();
    }

    @Test
    void emptyPlanSkipsWithNoTrades() {
        GateDecision decision = gate.evaluate(snapshot(1_000, null, 86_400), TradePlan.empty(), List.of(), NOW);

        assertThat(decision.proceed()).isFalse();
        assertThat(decision.reason()).isEqualTo(SkipReason.NO_TRADES);
    }

    @Test
    void costAboveBenefitSkips() {
        PortfolioSnapshot snapshot = snapshot(1_000, null, 86_400);
        TradePlan plan = new TradePlan(List.of(
                new TradeOrder("ETH", -0.2, -500, 2_500),
                new TradeOrder("BTC", 0.01, 500, 50_000)));

        GateDecision decision = gate.evaluate(snapshot, plan,
                List.of(new ScoredAsset("BTC", 0.4, RecommendedAction.INCREASE)), NOW);

        assertThat(decision.cost()).isCloseTo(12.0, offset(1e-9));
        assertThat(decision.benefit()).isCloseTo(4.0, offset(1e-9));
        assertThat(decision.proceed()).isFalse();
        assertThat(decision.reason()).isEqualTo(SkipReason.COST_EXCEEDS_BENEFIT);
    }

    @Test
    void benefitAboveCostProceeds() {
        PortfolioSnapshot snapshot = snapshot(100_000, NOW.minus(Duration.ofDays(8)), 86_400);
        TradePlan plan = new TradePlan(List.of(
                new TradeOrder("ETH", -2, -5_000, 2_500),
                new TradeOrder("BTC", 0.1, 5_000, 50_000)));

        GateDecision decision = gate.evaluate(snapshot, plan,
                List.of(new ScoredAsset("BTC", 0.8, RecommendedAction.INCREASE)), NOW);

        assertThat(decision.proceed()).isTrue();
        assertThat(decision.reason()).isNull();
        assertThat(decision.cost()).isCloseTo(30.0, offset(1e-9));
        assertThat(decision.benefit()).isCloseTo(800.0, offset(1e-9));
    }

    @Test
    void assetsOutsideComfortBandAddNoBenefit() {
        PortfolioSnapshot snapshot = new PortfolioSnapshot(1L, "user-1", List.of(
                new AssetHolding("BTC", 1, 45_000, 45_000, 0.45, true),
                new AssetHolding("ALT", 1, 5_000, 5_000, 0.05, true),
                new AssetHolding("ETH", 1, 50_000, 50_000, 0.5, true)),
                100_000, null, 86_400, 1.0, NOW);

        double benefit = gate.estimateBenefit(snapshot, List.of(
                new ScoredAsset("BTC", 0.9, RecommendedAction.INCREASE),
                new ScoredAsset("ALT", -0.9, RecommendedAction.DECREASE),
                new ScoredAsset("ETH", -0.5, RecommendedAction.DECREASE)));

        assertThat(benefit).isCloseTo(500.0, offset(1e-9));
    }

    private static PortfolioSnapshot snapshot(double total, Instant lastRebalance, long checkInterval) {
        return new PortfolioSnapshot(1L, "user-1", List.of(
                new AssetHolding("BTC", 1, total * 0.3, total * 0.3, 0.3, true),
                new AssetHolding("ETH", 1, total * 0.5, total * 0.5, 0.5, true),
                new AssetHolding("USDC", total * 0.2, 1.0, total * 0.2, 0.2, true)),
                total, lastRebalance, checkInterval, 1.0, NOW);
    }
}
