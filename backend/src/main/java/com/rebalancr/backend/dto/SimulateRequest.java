package com.rebalancr.backend.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

public record SimulateRequest(@NotEmpty Map<String, Double> targetAllocations) {
}
