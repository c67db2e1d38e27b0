package com.rebalancr.backend.service;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.dto.AutoRebalanceStatus;
import com.rebalancr.backend.dto.PortfolioUpdate;
import com.rebalancr.backend.model.Portfolio;
import com.rebalancr.backend.model.RebalanceFrequency;
import com.rebalancr.backend.rebalance.CostBenefitGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class AutoRebalanceService {

    private final PortfolioService portfolioService;
    private final CostBenefitGate costBenefitGate;
    private final ExecutionProperties executionProperties;

    public AutoRebalanceStatus enable(String userId, Long portfolioId, String frequency, Double maxSlippage) {
        RebalanceFrequency resolved = RebalanceFrequency.fromLabel(frequency);
        double slippage = maxSlippage != null ? maxSlippage : executionProperties.getDefaultSlippagePercent();
        Portfolio portfolio = portfolioService.update(userId, portfolioId,
                new PortfolioUpdate(true, slippage, resolved.seconds(), null));
        log.info("Auto-rebalance enabled portfolio={} frequency={} slippage={}%", portfolioId, resolved.label(), slippage);
        return toStatus(portfolio, "Automatic rebalancing enabled " + resolved.label() + " with max slippage of "
                + slippage + "%" + intervalNote(portfolio));
    }

    public AutoRebalanceStatus disable(String userId, Long portfolioId) {
        Portfolio portfolio = portfolioService.update(userId, portfolioId,
                new PortfolioUpdate(false, null, null, null));
        log.info("Auto-rebalance disabled portfolio={}", portfolioId);
        return toStatus(portfolio, "Automatic rebalancing disabled");
    }

    public AutoRebalanceStatus status(String userId, Long portfolioId) {
        Portfolio portfolio = portfolioService.get(userId, portfolioId);
        String message = portfolio.isAutoRebalance()
                ? "Automatic rebalancing is active (" + RebalanceFrequency.fromSeconds(portfolio.getCheckInterval()).label() + ")"
                        + intervalNote(portfolio)
                : "Automatic rebalancing is not active";
        return toStatus(portfolio, message);
    }

    // The gate's minimum interval overrides shorter check intervals.
    private String intervalNote(Portfolio portfolio) {
        Duration effective = costBenefitGate.effectiveInterval(portfolio.getCheckInterval());
        if (effective.toSeconds() <= portfolio.getCheckInterval()) {
            return "";
        }
        return "; rebalances run at most every " + describe(effective);
    }

    private static String describe(Duration interval) {
        if (interval.toSeconds() % 86_400 == 0) {
            long days = interval.toDays();
            return days == 1 ? "day" : days + " days";
        }
        long hours = Math.max(1L, interval.toHours());
        return hours == 1 ? "hour" : hours + " hours";
    }

    private AutoRebalanceStatus toStatus(Portfolio portfolio, String message) {
        return new AutoRebalanceStatus(
                portfolio.getId(),
                portfolio.isAutoRebalance(),
                RebalanceFrequency.fromSeconds(portfolio.getCheckInterval()).label(),
                portfolio.getCheckInterval(),
                costBenefitGate.effectiveInterval(portfolio.getCheckInterval()).toSeconds(),
                portfolio.getMaxSlippage(),
                portfolio.getLastRebalanceTimestamp(),
                costBenefitGate.nextEligibleAt(portfolio.getLastRebalanceTimestamp(), portfolio.getCheckInterval()),
                message);
    }
}
