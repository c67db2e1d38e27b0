package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.service.RebalanceMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches a trade plan order by order. Each dispatch is bounded by the configured timeout and
 * a failed order never stops the ones after it.
 */
@Slf4j
@Service
public class ExecutionCoordinator {

    private final TradeExecutor tradeExecutor;
    private final ExecutionProperties executionProperties;
    private final RebalanceMetricsService metricsService;
    private final Executor executionExecutor;

    public ExecutionCoordinator(TradeExecutor tradeExecutor,
                                ExecutionProperties executionProperties,
                                RebalanceMetricsService metricsService,
                                @Qualifier("executionExecutor") Executor executionExecutor) {
        this.tradeExecutor = tradeExecutor;
        this.executionProperties = executionProperties;
        this.metricsService = metricsService;
        this.executionExecutor = executionExecutor;
    }

    public List<TradeOutcome> execute(TradePlan plan, double maxSlippagePercent) {
        List<TradeOutcome> outcomes = new ArrayList<>();
        for (TradeOrder order : plan.orders()) {
            if (order.amount() == 0.0) {
                continue;
            }
            TradeOutcome outcome = dispatch(order, maxSlippagePercent);
            if (outcome.success()) {
                metricsService.recordOrderSuccess();
                log.info("✅ Order filled {} amount={} tx={}", order.symbol(), order.amount(), outcome.txReference());
            } else {
                metricsService.recordOrderFailure(outcome.status().name());
                log.warn("❌ Order failed {} amount={} status={} error={}", order.symbol(), order.amount(),
                        outcome.status(), outcome.error());
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private TradeOutcome dispatch(TradeOrder order, double maxSlippagePercent) {
        long timeoutMs = executionProperties.getDispatchTimeout().toMillis();
        CompletableFuture<OrderReceipt> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> tradeExecutor.submitOrder(order.symbol(), order.amount(), maxSlippagePercent),
                    executionExecutor);
        } catch (RuntimeException e) {
            return TradeOutcome.failed(order, TradeOutcome.OutcomeStatus.ERROR, "dispatch refused: " + e.getMessage());
        }
        try {
            OrderReceipt receipt = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (receipt != null && receipt.success()) {
                return TradeOutcome.succeeded(order, receipt.txReference());
            }
            String error = receipt == null ? "no receipt" : receipt.error();
            return TradeOutcome.failed(order, TradeOutcome.OutcomeStatus.REJECTED, error);
        } catch (TimeoutException e) {
            future.cancel(true);
            return TradeOutcome.failed(order, TradeOutcome.OutcomeStatus.TIMEOUT,
                    "timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return TradeOutcome.failed(order, TradeOutcome.OutcomeStatus.ERROR, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TradeOutcome.failed(order, TradeOutcome.OutcomeStatus.ERROR, "interrupted");
        }
    }
}
