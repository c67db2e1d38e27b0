package com.rebalancr.backend.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record RebalanceEventResponse(Long id, Long portfolioId, String eventType, JsonNode details, Instant timestamp) {
}
