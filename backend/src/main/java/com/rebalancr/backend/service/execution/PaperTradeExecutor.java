package com.rebalancr.backend.service.execution;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.rebalance.OrderReceipt;
import com.rebalancr.backend.rebalance.TradeExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Simulated venue: accepts every order within the slippage bounds and returns a fake transaction hash.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rebalancr.execution", name = "paper-mode", havingValue = "true", matchIfMissing = true)
public class PaperTradeExecutor implements TradeExecutor {

    private final ExecutionProperties executionProperties;

    @Override
    public OrderReceipt submitOrder(String symbol, double signedAmount, double maxSlippagePercent) {
        if (signedAmount == 0.0) {
            return OrderReceipt.rejected("zero amount");
        }
        if (maxSlippagePercent < executionProperties.getMinSlippagePercent()
                || maxSlippagePercent > executionProperties.getMaxSlippagePercent()) {
            return OrderReceipt.rejected("slippage " + maxSlippagePercent + "% outside allowed range");
        }
        long latencyMs = executionProperties.getPaperFillLatency().toMillis();
        if (latencyMs > 0) {
            try {
                Thread.sleep(latencyMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OrderReceipt.rejected("interrupted");
            }
        }
        String txHash = "0x" + UUID.randomUUID().toString().replace("-", "")
                + UUID.randomUUID().toString().replace("-", "");
        log.info("📝 Paper {} {} {} tx={}", signedAmount > 0 ? "BUY" : "SELL", Math.abs(signedAmount), symbol, txHash);
        return OrderReceipt.filled(txHash);
    }
}
