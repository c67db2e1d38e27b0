package com.rebalancr.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class SignalSourceResilienceConfig {

    @Bean
    public CircuitBreaker signalSourceCircuitBreaker(
            @Value("${rebalancr.signals.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${rebalancr.signals.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${rebalancr.signals.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("signal-sources", config);
    }

    @Bean
    public RateLimiter signalSourceRateLimiter(
            @Value("${rebalancr.signals.resilience.rate.limit-per-second:20}") int limitPerSecond,
            @Value("${rebalancr.signals.resilience.rate.timeout-ms:2000}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("signal-sources", config);
    }

    @Bean
    public Retry signalSourceRetry(
            @Value("${rebalancr.signals.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${rebalancr.signals.resilience.retry.base-delay-ms:300}") long baseDelayMs,
            @Value("${rebalancr.signals.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("signal-sources", config);
    }
}
