package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.service.RebalanceMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionCoordinatorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RebalanceMetricsService metricsService = new RebalanceMetricsService(meterRegistry);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void timedOutOrderDoesNotStopTheRest() {
        ExecutionProperties properties = new ExecutionProperties();
        properties.setDispatchTimeout(Duration.ofMillis(200));
        TradeExecutor tradeExecutor = (symbol, amount, slippage) -> {
            if (symbol.equals("ETH")) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return OrderReceipt.filled("0x" + symbol);
        };
        ExecutionCoordinator coordinator = new ExecutionCoordinator(tradeExecutor, properties, metricsService, executor);

        List<TradeOutcome> outcomes = coordinator.execute(plan(), 1.0);

        assertThat(outcomes).extracting(TradeOutcome::status).containsExactly(
                TradeOutcome.OutcomeStatus.SUCCESS,
                TradeOutcome.OutcomeStatus.TIMEOUT,
                TradeOutcome.OutcomeStatus.SUCCESS);
        assertThat(outcomes.get(0).txReference()).isEqualTo("0xSOL");
        assertThat(outcomes.get(1).error()).contains("200 ms");
        assertThat(meterRegistry.get("trade_orders_succeeded_total").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("trade_orders_failed_total").tag("kind", "TIMEOUT").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void rejectedAndThrowingOrdersAreReportedSeparately() {
        TradeExecutor tradeExecutor = mock(TradeExecutor.class);
        when(tradeExecutor.submitOrder(eq("SOL"), anyDouble(), anyDouble()))
                .thenReturn(OrderReceipt.rejected("slippage exceeded"));
        when(tradeExecutor.submitOrder(eq("ETH"), anyDouble(), anyDouble()))
                .thenThrow(new IllegalStateException("rpc unavailable"));
        when(tradeExecutor.submitOrder(eq("BTC"), anyDouble(), anyDouble()))
                .thenReturn(OrderReceipt.filled("0xabc"));
        ExecutionCoordinator coordinator = new ExecutionCoordinator(tradeExecutor, new ExecutionProperties(),
                metricsService, executor);

        List<TradeOutcome> outcomes = coordinator.execute(plan(), 0.5);

        assertThat(outcomes).extracting(TradeOutcome::status).containsExactly(
                TradeOutcome.OutcomeStatus.REJECTED,
                TradeOutcome.OutcomeStatus.ERROR,
                TradeOutcome.OutcomeStatus.SUCCESS);
        assertThat(outcomes.get(0).error()).isEqualTo("slippage exceeded");
        assertThat(outcomes.get(1).error()).isEqualTo("rpc unavailable");
        verify(tradeExecutor).submitOrder("BTC", 0.01, 0.5);
    }

    @Test
    void zeroAmountOrdersAreNotDispatched() {
        TradeExecutor tradeExecutor = mock(TradeExecutor.class);
        ExecutionCoordinator coordinator = new ExecutionCoordinator(tradeExecutor, new ExecutionProperties(),
                metricsService, executor);

        List<TradeOutcome> outcomes = coordinator.execute(
                new TradePlan(List.of(new TradeOrder("BTC", 0.0, 0.0, 50_000))), 1.0);

        assertThat(outcomes).isEmpty();
        verify(tradeExecutor, never()).submitOrder(eq("BTC"), anyDouble(), anyDouble());
    }

    private static TradePlan plan() {
        return new TradePlan(List.of(
                new TradeOrder("SOL", -10, -1_000, 100),
                new TradeOrder("ETH", -0.4, -1_000, 2_500),
                new TradeOrder("BTC", 0.01, 500, 50_000)));
    }
}
