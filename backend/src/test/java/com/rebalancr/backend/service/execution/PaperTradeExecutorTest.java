package com.rebalancr.backend.service.execution;

import com.rebalancr.backend.config.ExecutionProperties;
import com.rebalancr.backend.rebalance.OrderReceipt;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaperTradeExecutorTest {

    private final PaperTradeExecutor executor = new PaperTradeExecutor(new ExecutionProperties());

    @Test
    void fillsOrderWithTransactionHash() {
        OrderReceipt receipt = executor.submitOrder("ETH", -1.5, 1.0);

        assertThat(receipt.success()).isTrue();
        assertThat(receipt.txReference()).matches("0x[0-9a-f]{64}");
        assertThat(receipt.error()).isNull();
    }

    @Test
    void rejectsZeroAmount() {
        OrderReceipt receipt = executor.submitOrder("ETH", 0.0, 1.0);

        assertThat(receipt.success()).isFalse();
        assertThat(receipt.error()).isEqualTo("zero amount");
    }

    @Test
    void rejectsSlippageOutsideAllowedRange() {
        assertThat(executor.submitOrder("BTC", 0.1, 0.05).success()).isFalse();
        assertThat(executor.submitOrder("BTC", 0.1, 5.5).success()).isFalse();
        assertThat(executor.submitOrder("BTC", 0.1, 5.0).success()).isTrue();
    }
}
