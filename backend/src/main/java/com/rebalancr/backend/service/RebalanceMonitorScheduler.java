package com.rebalancr.backend.service;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.model.Portfolio;
import com.rebalancr.backend.model.RebalanceEventType;
import com.rebalancr.backend.rebalance.AnalysisResult;
import com.rebalancr.backend.rebalance.CostBenefitGate;
import com.rebalancr.backend.rebalance.PerformanceLogger;
import com.rebalancr.backend.rebalance.RebalancePipelineService;
import com.rebalancr.backend.rebalance.RebalanceTrigger;
import com.rebalancr.backend.repository.PortfolioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class RebalanceMonitorScheduler {

    private final PortfolioRepository portfolioRepository;
    private final RebalancePipelineService pipelineService;
    private final PerformanceLogger performanceLogger;
    private final CostBenefitGate costBenefitGate;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final RebalanceProperties rebalanceProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${rebalancr.rebalance.monitor.interval-ms:300000}",
            initialDelayString = "${rebalancr.rebalance.monitor.initial-delay-ms:60000}")
    public void monitorPortfolios() {
        if (!rebalanceProperties.getMonitor().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("rebalanceMonitor", this::runCycle);
    }

    /**
     * Evaluates every portfolio with auto-rebalance on whose interval has elapsed.
     *
     * @return number of portfolios evaluated
     */
    public int runCycle() {
        List<Portfolio> active = portfolioRepository.findByAutoRebalanceTrueOrderByIdAsc();
        Instant now = Instant.now(clock);
        int evaluated = 0;
        for (Portfolio portfolio : active) {
            if (!costBenefitGate.intervalElapsed(portfolio.getLastRebalanceTimestamp(), portfolio.getCheckInterval(), now)) {
                log.debug("Portfolio {} not due for rebalance", portfolio.getId());
                continue;
            }
            scheduledTaskGuard.run("rebalanceMonitor:" + portfolio.getId(), () -> evaluate(portfolio));
            evaluated++;
        }
        log.info("Rebalance monitor cycle active={} evaluated={}", active.size(), evaluated);
        return evaluated;
    }

    private void evaluate(Portfolio portfolio) {
        if (rebalanceProperties.getMonitor().isExecuteTrades()) {
            pipelineService.rebalance(portfolio.getUserId(), portfolio.getId(), false, null, RebalanceTrigger.MONITOR);
            return;
        }
        AnalysisResult analysis = pipelineService.analyze(portfolio.getUserId(), portfolio.getId());
        if (!analysis.rebalanceRecommended()) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("marketCondition", analysis.marketCondition());
        details.put("target", analysis.target());
        details.put("tradePlan", analysis.tradePlan());
        details.put("gate", analysis.gate());
        details.put("validation", analysis.validation());
        details.put("degradedAssets", analysis.degradedAssets());
        performanceLogger.record(portfolio.getId(), RebalanceEventType.REBALANCE_RECOMMENDATION, details);
        log.info("💡 Rebalance recommended for portfolio {}", portfolio.getId());
    }
}
