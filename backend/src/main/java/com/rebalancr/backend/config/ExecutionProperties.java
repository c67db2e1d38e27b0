package com.rebalancr.backend.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "rebalancr.execution")
@Data
@Validated
public class ExecutionProperties {

    @NotNull
    private Duration dispatchTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration lockWait = Duration.ZERO;

    // Slippage bounds are percentages.
    @DecimalMin("0.0")
    private double minSlippagePercent = 0.1;

    @DecimalMin("0.0")
    private double maxSlippagePercent = 5.0;

    @DecimalMin("0.0")
    private double defaultSlippagePercent = 1.0;

    private boolean paperMode = true;

    @NotNull
    private Duration paperFillLatency = Duration.ZERO;
}
