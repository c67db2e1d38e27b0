package com.rebalancr.backend.service;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.dto.CreatePortfolioRequest;
import com.rebalancr.backend.dto.PortfolioUpdate;
import com.rebalancr.backend.exception.BadRequestException;
import com.rebalancr.backend.exception.NotFoundException;
import com.rebalancr.backend.model.Portfolio;
import com.rebalancr.backend.model.PortfolioAsset;
import com.rebalancr.backend.rebalance.AssetHolding;
import com.rebalancr.backend.rebalance.MarketDataProvider;
import com.rebalancr.backend.rebalance.PortfolioSnapshot;
import com.rebalancr.backend.rebalance.TradeOutcome;
import com.rebalancr.backend.repository.PortfolioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final PortfolioRepository portfolioRepository;
    private final MarketDataProvider marketDataProvider;
    private final ExecutionProperties executionProperties;
    private final Clock clock;

    @Transactional
    public Portfolio create(String userId, CreatePortfolioRequest request) {
        Instant now = Instant.now(clock);
        Portfolio portfolio = Portfolio.builder()
                .userId(userId)
                .name(request.name())
                .maxSlippage(request.maxSlippage() != null
                        ? request.maxSlippage()
                        : executionProperties.getDefaultSlippagePercent())
                .createdAt(now)
                .build();

        Map<String, CreatePortfolioRequest.AssetEntry> merged = new LinkedHashMap<>();
        for (CreatePortfolioRequest.AssetEntry entry : request.assets()) {
            String symbol = entry.symbol().trim().toUpperCase(Locale.ROOT);
            merged.merge(symbol, entry, (left, right) -> new CreatePortfolioRequest.AssetEntry(symbol,
                    left.tokenAddress() != null ? left.tokenAddress() : right.tokenAddress(),
                    left.amount() + right.amount()));
        }
        merged.forEach((symbol, entry) -> portfolio.addAsset(PortfolioAsset.builder()
                .symbol(symbol)
                .tokenAddress(entry.tokenAddress())
                .amount(entry.amount())
                .lastUpdated(now)
                .build()));

        Portfolio saved = portfolioRepository.save(portfolio);
        log.info("Portfolio created id={} user={} assets={}", saved.getId(), userId, saved.getAssets().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Portfolio> list(String userId) {
        return portfolioRepository.findByUserIdOrderByIdAsc(userId);
    }

    @Transactional(readOnly = true)
    public Portfolio get(String userId, Long portfolioId) {
        return portfolioRepository.findByIdAndUserId(portfolioId, userId)
                .orElseThrow(() -> new NotFoundException("Portfolio " + portfolioId + " not found"));
    }

    @Transactional
    public Portfolio update(String userId, Long portfolioId, PortfolioUpdate update) {
        Portfolio portfolio = get(userId, portfolioId);
        if (update.autoRebalance() != null) {
            portfolio.setAutoRebalance(update.autoRebalance());
        }
        if (update.maxSlippage() != null) {
            double slippage = update.maxSlippage();
            if (slippage < executionProperties.getMinSlippagePercent()
                    || slippage > executionProperties.getMaxSlippagePercent()) {
                throw new BadRequestException("Max slippage must be between "
                        + executionProperties.getMinSlippagePercent() + "% and "
                        + executionProperties.getMaxSlippagePercent() + "%");
            }
            portfolio.setMaxSlippage(slippage);
        }
        if (update.checkInterval() != null) {
            if (update.checkInterval() <= 0) {
                throw new BadRequestException("Check interval must be positive");
            }
            portfolio.setCheckInterval(update.checkInterval());
        }
        if (update.lastRebalanceTimestamp() != null) {
            portfolio.setLastRebalanceTimestamp(update.lastRebalanceTimestamp());
        }
        return portfolioRepository.save(portfolio);
    }

    /**
     * Values every holding at the latest price. An asset whose price cannot be fetched stays in the
     * snapshot with zero value and weight.
     */
    public PortfolioSnapshot snapshot(Portfolio portfolio) {
        List<double[]> valued = new ArrayList<>();
        double total = 0.0;
        for (PortfolioAsset asset : portfolio.getAssets()) {
            double price = priceOf(asset.getSymbol());
            double value = price > 0.0 ? asset.getAmount() * price : 0.0;
            valued.add(new double[]{price, value});
            total += value;
        }

        List<AssetHolding> holdings = new ArrayList<>();
        for (int i = 0; i < portfolio.getAssets().size(); i++) {
            PortfolioAsset asset = portfolio.getAssets().get(i);
            double price = valued.get(i)[0];
            double value = valued.get(i)[1];
            double weight = total > 0.0 ? value / total : 0.0;
            holdings.add(new AssetHolding(asset.getSymbol(), asset.getAmount(), price, value, weight, price > 0.0));
        }
        return new PortfolioSnapshot(portfolio.getId(), portfolio.getUserId(), holdings, total,
                portfolio.getLastRebalanceTimestamp(), portfolio.getCheckInterval(), portfolio.getMaxSlippage(),
                Instant.now(clock));
    }

    /**
     * Applies filled orders to the stored amounts. The rebalance timestamp moves only when at least one
     * order succeeded. Failures are logged and reported as {@code false}; executed trades are never undone.
     */
    public boolean applyExecution(Long portfolioId, List<TradeOutcome> outcomes, Instant executedAt) {
        List<TradeOutcome> filled = outcomes.stream().filter(TradeOutcome::success).toList();
        if (filled.isEmpty()) {
            log.info("No filled orders for portfolio {}, rebalance timestamp unchanged", portfolioId);
            return false;
        }
        try {
            Portfolio portfolio = portfolioRepository.findById(portfolioId)
                    .orElseThrow(() -> new NotFoundException("Portfolio " + portfolioId + " not found"));
            for (TradeOutcome outcome : filled) {
                portfolio.getAssets().stream()
                        .filter(asset -> asset.getSymbol().equals(outcome.symbol()))
                        .findFirst()
                        .ifPresent(asset -> {
                            asset.setAmount(Math.max(0.0, asset.getAmount() + outcome.amount()));
                            asset.setLastUpdated(executedAt);
                        });
            }
            portfolio.setLastRebalanceTimestamp(executedAt);
            portfolioRepository.save(portfolio);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to persist execution for portfolio {} ({} filled orders)", portfolioId, filled.size(), e);
            return false;
        }
    }

    private double priceOf(String symbol) {
        try {
            OptionalDouble price = marketDataProvider.latestPrice(symbol);
            return price.isPresent() && price.getAsDouble() > 0.0 ? price.getAsDouble() : 0.0;
        } catch (RuntimeException e) {
            log.warn("Price unavailable for {}: {}", symbol, e.getMessage());
            return 0.0;
        }
    }
}
