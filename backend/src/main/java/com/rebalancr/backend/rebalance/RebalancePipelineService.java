package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.exception.BadRequestException;
import com.rebalancr.backend.model.MarketCondition;
import com.rebalancr.backend.model.Portfolio;
import com.rebalancr.backend.model.RebalanceEventType;
import com.rebalancr.backend.model.RecommendedAction;
import com.rebalancr.backend.service.PortfolioService;
import com.rebalancr.backend.service.RebalanceMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs collect, score, plan, gate, review and execute for one portfolio. Every stage after
 * collection is pure; any of them may end the run with a skip or rejection, which is returned
 * as a result and logged as a rebalance event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalancePipelineService {

    private final PortfolioService portfolioService;
    private final SignalCollector signalCollector;
    private final ScoreCombiner scoreCombiner;
    private final AllocationPlanner allocationPlanner;
    private final TradePlanner tradePlanner;
    private final CostBenefitGate costBenefitGate;
    private final MarketConditionClassifier marketConditionClassifier;
    private final TradeReviewer tradeReviewer;
    private final ExecutionCoordinator executionCoordinator;
    private final PerformanceLogger performanceLogger;
    private final PortfolioLockRegistry lockRegistry;
    private final RebalanceMetricsService metricsService;
    private final ExecutionProperties executionProperties;
    private final Clock clock;

    public AnalysisResult analyze(String userId, Long portfolioId) {
        return analyze(userId, portfolioId, SignalProgressListener.NONE);
    }

    public AnalysisResult analyze(String userId, Long portfolioId, SignalProgressListener listener) {
        Portfolio portfolio = portfolioService.get(userId, portfolioId);
        PortfolioSnapshot snapshot = portfolioService.snapshot(portfolio);
        Map<String, AssetSignal> signals = signalCollector.collect(snapshot.symbols(), listener);
        Instant now = Instant.now(clock);

        List<ScoredAsset> scored = scoreAll(snapshot, signals);
        if (insufficientData(snapshot, signals)) {
            AllocationTarget target = snapshot.hasPricedHoldings() ? AllocationTarget.of(snapshot.currentWeights()) : null;
            GateDecision gate = GateDecision.skip(SkipReason.INSUFFICIENT_DATA, "no usable signal for any asset");
            ValidationResult validation = tradeReviewer.validate(List.of(), MarketCondition.NORMAL);
            return new AnalysisResult(snapshot.portfolioId(), snapshot.totalValue(),
                    assetAnalyses(snapshot, signals, scored, target), target, TradePlan.empty(), gate,
                    MarketCondition.NORMAL, validation, true, false, degradedAssets(signals), now);
        }

        AllocationTarget target = allocationPlanner.plan(snapshot.currentWeights(), scoreMap(scored));
        TradePlan plan = tradePlanner.plan(snapshot, target);
        GateDecision gate = costBenefitGate.evaluate(snapshot, plan, scored, now);
        MarketCondition condition = marketConditionClassifier.classify(signals.values());
        ValidationResult validation = tradeReviewer.validate(proposedActions(scored), condition);
        boolean recommended = gate.proceed() && validation.approved();
        return new AnalysisResult(snapshot.portfolioId(), snapshot.totalValue(),
                assetAnalyses(snapshot, signals, scored, target), target, plan, gate, condition, validation,
                false, recommended, degradedAssets(signals), now);
    }

    public RebalanceResult rebalance(String userId, Long portfolioId, boolean dryRun) {
        return rebalance(userId, portfolioId, dryRun, null, RebalanceTrigger.USER);
    }

    public RebalanceResult rebalance(String userId, Long portfolioId, boolean dryRun, Double maxSlippageOverride,
                                     RebalanceTrigger trigger) {
        portfolioService.get(userId, portfolioId);
        Optional<PortfolioLockRegistry.Lease> lease = lockRegistry.tryAcquire(portfolioId,
                executionProperties.getLockWait());
        if (lease.isEmpty()) {
            RebalanceResult result = baseResult(portfolioId, dryRun, List.of())
                    .status(RebalanceResult.RebalanceStatus.SKIPPED)
                    .skipReason(SkipReason.IN_PROGRESS)
                    .message(SkipReason.IN_PROGRESS.description())
                    .build();
            return finish(result, trigger, Map.of());
        }
        MDC.put("portfolioId", String.valueOf(portfolioId));
        try (PortfolioLockRegistry.Lease held = lease.get()) {
            // Re-read under the lease: a run that finished while this one waited must be visible to the gate.
            Portfolio portfolio = portfolioService.get(userId, portfolioId);
            return runPipeline(portfolio, dryRun, maxSlippageOverride, trigger, held.token());
        } finally {
            MDC.remove("portfolioId");
        }
    }

    public boolean cancel(String userId, Long portfolioId) {
        portfolioService.get(userId, portfolioId);
        return lockRegistry.cancel(portfolioId);
    }

    public SimulationResult simulate(String userId, Long portfolioId, Map<String, Double> targetAllocations) {
        Portfolio portfolio = portfolioService.get(userId, portfolioId);
        Map<String, Double> requested = normalizeRequest(targetAllocations);
        PortfolioSnapshot snapshot = portfolioService.snapshot(portfolio);

        Set<String> held = Set.copyOf(snapshot.symbols());
        List<String> notHeld = requested.keySet().stream().filter(symbol -> !held.contains(symbol)).toList();
        if (!notHeld.isEmpty()) {
            throw new BadRequestException("Assets not held in portfolio: " + String.join(", ", notHeld));
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        for (String symbol : snapshot.symbols()) {
            weights.put(symbol, requested.getOrDefault(symbol, 0.0));
        }
        AllocationTarget target = AllocationTarget.of(weights);
        TradePlan plan = tradePlanner.plan(snapshot, target);

        Map<String, AssetSignal> signals = signalCollector.collect(snapshot.symbols());
        MarketCondition condition = marketConditionClassifier.classify(signals.values());
        List<ProposedAction> actions = plan.orders().stream().map(ProposedAction::fromOrder).toList();
        ValidationResult validation = tradeReviewer.validate(actions, condition);
        List<String> unpriced = snapshot.holdings().stream()
                .filter(holding -> !holding.priced() && target.weightOf(holding.symbol()) > 0.0)
                .map(AssetHolding::symbol)
                .toList();
        return new SimulationResult(portfolioId, snapshot.totalValue(), requested, plan,
                costBenefitGate.estimateCost(plan), condition, validation, unpriced, Instant.now(clock));
    }

    private RebalanceResult runPipeline(Portfolio portfolio, boolean dryRun, Double maxSlippageOverride,
                                        RebalanceTrigger trigger, CancellationToken token) {
        Long portfolioId = portfolio.getId();
        PortfolioSnapshot snapshot = portfolioService.snapshot(portfolio);
        Map<String, AssetSignal> signals = signalCollector.collect(snapshot.symbols());
        List<String> degraded = degradedAssets(signals);
        signals.values().stream()
                .filter(AssetSignal::degraded)
                .forEach(signal -> metricsService.recordDegradedSignal(signal.status().name()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("signals", signals);
        if (token.isCancelled()) {
            return cancelled(portfolioId, dryRun, degraded, "collected", trigger, details);
        }

        List<ScoredAsset> scored = scoreAll(snapshot, signals);
        details.put("scores", scored);
        if (insufficientData(snapshot, signals)) {
            RebalanceResult result = baseResult(portfolioId, dryRun, degraded)
                    .status(RebalanceResult.RebalanceStatus.SKIPPED)
                    .skipReason(SkipReason.INSUFFICIENT_DATA)
                    .message("no usable signal for any asset")
                    .build();
            return finish(result, trigger, details);
        }
        if (token.isCancelled()) {
            return cancelled(portfolioId, dryRun, degraded, "scored", trigger, details);
        }

        AllocationTarget target = allocationPlanner.plan(snapshot.currentWeights(), scoreMap(scored));
        TradePlan plan = tradePlanner.plan(snapshot, target);
        if (token.isCancelled()) {
            return cancelled(portfolioId, dryRun, degraded, "planned", trigger, details);
        }

        GateDecision gate = costBenefitGate.evaluate(snapshot, plan, scored, Instant.now(clock));
        if (!gate.proceed()) {
            RebalanceResult result = baseResult(portfolioId, dryRun, degraded)
                    .status(RebalanceResult.RebalanceStatus.SKIPPED)
                    .skipReason(gate.reason())
                    .message(gate.message())
                    .target(target)
                    .tradePlan(plan)
                    .gate(gate)
                    .build();
            return finish(result, trigger, details);
        }
        if (token.isCancelled()) {
            return cancelled(portfolioId, dryRun, degraded, "gated", trigger, details);
        }

        MarketCondition condition = marketConditionClassifier.classify(signals.values());
        ValidationResult validation = tradeReviewer.validate(proposedActions(scored), condition);
        if (!validation.approved()) {
            RebalanceResult result = baseResult(portfolioId, dryRun, degraded)
                    .status(RebalanceResult.RebalanceStatus.REJECTED)
                    .message(String.format(Locale.ROOT, "rejected by review: approval rate %.2f, risk %.1f",
                            validation.approvalRate(), validation.overallRisk()))
                    .target(target)
                    .tradePlan(plan)
                    .gate(gate)
                    .validation(validation)
                    .build();
            return finish(result, trigger, details);
        }
        if (token.isCancelled()) {
            return cancelled(portfolioId, dryRun, degraded, "validated", trigger, details);
        }

        if (dryRun) {
            RebalanceResult result = baseResult(portfolioId, true, degraded)
                    .status(RebalanceResult.RebalanceStatus.DRY_RUN)
                    .message("dry run: " + plan.size() + " orders not submitted")
                    .target(target)
                    .tradePlan(plan)
                    .gate(gate)
                    .validation(validation)
                    .build();
            return finish(result, trigger, details);
        }

        double slippage = maxSlippageOverride != null ? maxSlippageOverride : snapshot.maxSlippage();
        log.info("🚀 Executing rebalance portfolio={} orders={} slippage={}%", portfolioId, plan.size(), slippage);
        List<TradeOutcome> outcomes = executionCoordinator.execute(plan, slippage);
        boolean allSucceeded = outcomes.stream().allMatch(TradeOutcome::success);
        boolean updated = portfolioService.applyExecution(portfolioId, outcomes, Instant.now(clock));
        long filled = outcomes.stream().filter(TradeOutcome::success).count();
        RebalanceResult result = baseResult(portfolioId, false, degraded)
                .status(RebalanceResult.RebalanceStatus.EXECUTED)
                .message(filled + " of " + outcomes.size() + " orders succeeded")
                .target(target)
                .tradePlan(plan)
                .gate(gate)
                .validation(validation)
                .outcomes(outcomes)
                .allSucceeded(allSucceeded)
                .portfolioUpdated(updated)
                .build();
        details.put("outcomes", outcomes);
        return finish(result, trigger, details);
    }

    private List<ScoredAsset> scoreAll(PortfolioSnapshot snapshot, Map<String, AssetSignal> signals) {
        List<ScoredAsset> scored = new ArrayList<>();
        for (AssetHolding holding : snapshot.holdings()) {
            AssetSignal signal = signals.get(holding.symbol());
            if (!holding.priced() || signal == null) {
                scored.add(new ScoredAsset(holding.symbol(), 0.0, RecommendedAction.MAINTAIN));
            } else {
                scored.add(scoreCombiner.evaluate(signal));
            }
        }
        return scored;
    }

    private boolean insufficientData(PortfolioSnapshot snapshot, Map<String, AssetSignal> signals) {
        if (!snapshot.hasPricedHoldings()) {
            return true;
        }
        return snapshot.holdings().stream()
                .filter(AssetHolding::priced)
                .map(holding -> signals.get(holding.symbol()))
                .noneMatch(signal -> signal != null && signal.usable());
    }

    private Map<String, Double> scoreMap(List<ScoredAsset> scored) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scored.forEach(asset -> scores.put(asset.symbol(), asset.score()));
        return scores;
    }

    private List<ProposedAction> proposedActions(List<ScoredAsset> scored) {
        return scored.stream().map(ProposedAction::fromScore).toList();
    }

    private List<String> degradedAssets(Map<String, AssetSignal> signals) {
        return signals.values().stream().filter(AssetSignal::degraded).map(AssetSignal::symbol).toList();
    }

    private List<AssetAnalysis> assetAnalyses(PortfolioSnapshot snapshot, Map<String, AssetSignal> signals,
                                              List<ScoredAsset> scored, AllocationTarget target) {
        Map<String, ScoredAsset> bySymbol = scored.stream()
                .collect(Collectors.toMap(ScoredAsset::symbol, asset -> asset, (left, right) -> left));
        List<AssetAnalysis> analyses = new ArrayList<>();
        for (AssetHolding holding : snapshot.holdings()) {
            AssetSignal signal = signals.get(holding.symbol());
            ScoredAsset asset = bySymbol.get(holding.symbol());
            List<String> errors = new ArrayList<>(signal == null ? List.of("signals not collected") : signal.errors());
            if (!holding.priced()) {
                errors.add("price unavailable");
            }
            AssetSignal.SignalStatus status = signal == null ? AssetSignal.SignalStatus.UNAVAILABLE : signal.status();
            analyses.add(new AssetAnalysis(
                    holding.symbol(),
                    holding.amount(),
                    holding.price(),
                    holding.value(),
                    holding.priced(),
                    holding.weight(),
                    target == null ? holding.weight() : target.weightOf(holding.symbol()),
                    asset.score(),
                    asset.confidence(),
                    asset.action(),
                    signal == null ? SignalSet.neutral() : signal.signals(),
                    status,
                    status != AssetSignal.SignalStatus.COMPLETE,
                    errors));
        }
        return analyses;
    }

    private RebalanceResult.RebalanceResultBuilder baseResult(Long portfolioId, boolean dryRun, List<String> degraded) {
        return RebalanceResult.builder()
                .portfolioId(portfolioId)
                .dryRun(dryRun)
                .degradedAssets(degraded)
                .completedAt(Instant.now(clock));
    }

    private RebalanceResult cancelled(Long portfolioId, boolean dryRun, List<String> degraded, String stage,
                                      RebalanceTrigger trigger, Map<String, Object> details) {
        RebalanceResult result = baseResult(portfolioId, dryRun, degraded)
                .status(RebalanceResult.RebalanceStatus.SKIPPED)
                .skipReason(SkipReason.CANCELLED)
                .message("cancelled after " + stage)
                .build();
        return finish(result, trigger, details);
    }

    private RebalanceResult finish(RebalanceResult result, RebalanceTrigger trigger, Map<String, Object> stageDetails) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", result.status());
        details.put("reason", result.skipReason());
        details.put("message", result.message());
        details.put("dryRun", result.dryRun());
        details.put("trigger", trigger);
        details.putAll(stageDetails);
        details.put("target", result.target());
        details.put("tradePlan", result.tradePlan());
        details.put("gate", result.gate());
        details.put("validation", result.validation());
        if (result.status() == RebalanceResult.RebalanceStatus.EXECUTED) {
            details.put("allSucceeded", result.allSucceeded());
            details.put("portfolioUpdated", result.portfolioUpdated());
        }
        performanceLogger.record(result.portfolioId(), eventTypeFor(result, trigger), details);

        String reason = result.skipReason() == null ? null : result.skipReason().name();
        metricsService.recordOutcome(result.status().name(), reason);
        log.info("Rebalance finished portfolio={} status={} reason={} message={}", result.portfolioId(),
                result.status(), reason, result.message());
        return result;
    }

    private RebalanceEventType eventTypeFor(RebalanceResult result, RebalanceTrigger trigger) {
        return switch (result.status()) {
            case SKIPPED -> RebalanceEventType.REBALANCE_SKIPPED;
            case REJECTED -> RebalanceEventType.REBALANCE_REJECTED;
            case DRY_RUN -> RebalanceEventType.REBALANCE_DRY_RUN;
            case EXECUTED -> trigger == RebalanceTrigger.MONITOR
                    ? RebalanceEventType.AUTO_REBALANCE
                    : RebalanceEventType.REBALANCE_EXECUTED;
        };
    }

    private Map<String, Double> normalizeRequest(Map<String, Double> targetAllocations) {
        if (targetAllocations == null || targetAllocations.isEmpty()) {
            throw new BadRequestException("Target allocations are required");
        }
        Map<String, Double> requested = new LinkedHashMap<>();
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : targetAllocations.entrySet()) {
            Double weight = entry.getValue();
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new BadRequestException("Target allocation has a blank symbol");
            }
            if (weight == null || weight.isNaN() || weight < 0.0) {
                throw new BadRequestException("Invalid weight for " + entry.getKey());
            }
            requested.merge(entry.getKey().trim().toUpperCase(Locale.ROOT), weight, Double::sum);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > AllocationTarget.SUM_TOLERANCE) {
            throw new BadRequestException(String.format(Locale.ROOT,
                    "Target allocations must sum to 1.0, got %.4f", sum));
        }
        return requested;
    }
}
