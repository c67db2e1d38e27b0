package com.rebalancr.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "rebalancr.signals")
@Data
@Validated
public class SignalProperties {

    @Min(1)
    private int maxConcurrency = 10;

    @Min(2)
    private int historyBars = 30;

    @Valid
    private Statistics statistics = new Statistics();

    @Valid
    private Source sentiment = new Source("http://localhost:8090");

    @Valid
    private Source market = new Source("http://localhost:8091");

    @Data
    public static class Statistics {
        // Per-bar standard deviation of returns that maps to volatility 1.0.
        @Positive
        private double volatilityScale = 0.1;
        @Min(2)
        private int medianWindow = 7;
        @Positive
        private double trendThreshold = 0.02;
    }

    @Data
    public static class Source {
        private String baseUrl;
        private String apiKey = "";
        @Min(1)
        private int connectTimeoutMs = 5000;
        @Min(1)
        private int readTimeoutMs = 10000;

        public Source() {
        }

        public Source(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
