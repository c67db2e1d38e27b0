package com.rebalancr.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    @Qualifier("signalExecutor")
    private Executor signalExecutor;

    @Autowired
    @Qualifier("executionExecutor")
    private Executor executionExecutor;

    @Test
    void signalExecutorCoversConfiguredConcurrency() {
        assertThat(signalExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) signalExecutor;
        int processors = Runtime.getRuntime().availableProcessors();
        int expectedMax = Math.max(4, processors * 2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(expectedMax);
        assertThat(executor.getCorePoolSize()).isEqualTo(Math.min(Math.max(4, processors), expectedMax));
        assertThat(executor.getThreadNamePrefix()).isEqualTo("signal-");
        assertThat(executor.getQueueCapacity()).isEqualTo(500);
    }

    @Test
    void executionExecutorIsBounded() {
        assertThat(executionExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) executionExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("execution-");
        assertThat(executor.getQueueCapacity()).isEqualTo(100);
    }
}
