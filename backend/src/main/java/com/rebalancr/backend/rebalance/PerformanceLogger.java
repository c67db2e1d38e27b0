package com.rebalancr.backend.rebalance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalancr.backend.dto.PerformanceSummary;
import com.rebalancr.backend.model.RebalanceEvent;
import com.rebalancr.backend.model.RebalanceEventType;
import com.rebalancr.backend.repository.RebalanceEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only log of rebalance decisions. Writing never throws; a failed write is reported
 * on the operational log and the caller carries on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceLogger {

    private final RebalanceEventRepository rebalanceEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void record(Long portfolioId, RebalanceEventType type, Object details) {
        String payload;
        try {
            payload = details == null ? null : objectMapper.writeValueAsString(details);
        } catch (Exception e) {
            log.warn("Failed to serialize {} event for portfolio {}: {}", type.code(), portfolioId, e.getMessage());
            payload = "{\"serializationError\":true}";
        }
        log(RebalanceEvent.builder()
                .portfolioId(portfolioId)
                .eventType(type.code())
                .details(payload)
                .correlationId(MDC.get("correlationId"))
                .createdAt(Instant.now(clock))
                .build());
    }

    public void log(RebalanceEvent event) {
        try {
            rebalanceEventRepository.save(event);
            log.debug("Logged {} event for portfolio {}", event.getEventType(), event.getPortfolioId());
        } catch (Exception e) {
            log.warn("Failed to log {} event for portfolio {}: {}", event.getEventType(), event.getPortfolioId(),
                    e.getMessage());
        }
    }

    public List<RebalanceEvent> recentEvents(Long portfolioId, RebalanceEventType type, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        if (type == null) {
            return rebalanceEventRepository.findByPortfolioIdOrderByCreatedAtDescIdDesc(portfolioId, page);
        }
        return rebalanceEventRepository.findByPortfolioIdAndEventTypeOrderByCreatedAtDescIdDesc(portfolioId,
                type.code(), page);
    }

    public PerformanceSummary summarize(Long portfolioId, int days) {
        Instant from = Instant.now(clock).minus(Duration.ofDays(days));
        List<RebalanceEvent> events = rebalanceEventRepository
                .findByPortfolioIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(portfolioId, from);

        Map<String, Long> byType = new TreeMap<>();
        long executed = 0;
        long succeeded = 0;
        long failed = 0;
        double tradedValue = 0.0;
        Instant lastExecutedAt = null;
        for (RebalanceEvent event : events) {
            byType.merge(event.getEventType(), 1L, Long::sum);
            JsonNode outcomes = outcomesOf(event);
            if (outcomes == null || !outcomes.isArray()) {
                continue;
            }
            executed++;
            if (lastExecutedAt == null) {
                lastExecutedAt = event.getCreatedAt();
            }
            for (JsonNode outcome : outcomes) {
                if ("SUCCESS".equals(outcome.path("status").asText())) {
                    succeeded++;
                    tradedValue += Math.abs(outcome.path("value").asDouble(0.0));
                } else {
                    failed++;
                }
            }
        }
        return new PerformanceSummary(portfolioId, days, from, events.size(), byType, executed, succeeded, failed,
                tradedValue, lastExecutedAt);
    }

    private JsonNode outcomesOf(RebalanceEvent event) {
        if (event.getDetails() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(event.getDetails()).get("outcomes");
        } catch (Exception e) {
            log.debug("Unreadable details on event {}: {}", event.getId(), e.getMessage());
            return null;
        }
    }
}
