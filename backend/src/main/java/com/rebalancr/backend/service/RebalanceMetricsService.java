package com.rebalancr.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RebalanceMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordOutcome(String status, String reason) {
        Counter.builder("rebalance_outcomes_total")
                .tag("status", status)
                .tag("reason", reason == null ? "none" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordDegradedSignal(String status) {
        Counter.builder("signal_degraded_total")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordOrderFailure(String kind) {
        Counter.builder("trade_orders_failed_total")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }

    public void recordOrderSuccess() {
        Counter.builder("trade_orders_succeeded_total")
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskFailure(String task) {
        Counter.builder("scheduled_task_failures_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }
}
