package com.rebalancr.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalancr.backend.config.RequestCorrelationFilter;
import com.rebalancr.backend.dto.AutoRebalanceRequest;
import com.rebalancr.backend.dto.AutoRebalanceStatus;
import com.rebalancr.backend.dto.CreatePortfolioRequest;
import com.rebalancr.backend.dto.PerformanceSummary;
import com.rebalancr.backend.dto.PortfolioResponse;
import com.rebalancr.backend.dto.RebalanceEventResponse;
import com.rebalancr.backend.dto.RebalanceRequest;
import com.rebalancr.backend.dto.SimulateRequest;
import com.rebalancr.backend.exception.BadRequestException;
import com.rebalancr.backend.model.RebalanceEvent;
import com.rebalancr.backend.model.RebalanceEventType;
import com.rebalancr.backend.rebalance.AnalysisResult;
import com.rebalancr.backend.rebalance.PerformanceLogger;
import com.rebalancr.backend.rebalance.RebalancePipelineService;
import com.rebalancr.backend.rebalance.RebalanceResult;
import com.rebalancr.backend.rebalance.RebalanceTrigger;
import com.rebalancr.backend.rebalance.SimulationResult;
import com.rebalancr.backend.service.AutoRebalanceService;
import com.rebalancr.backend.service.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/portfolios")
@RequiredArgsConstructor
@Tag(name = "Portfolios")
public class PortfolioController {

    private static final String USER_HEADER = RequestCorrelationFilter.USER_ID_HEADER;

    private final PortfolioService portfolioService;
    private final RebalancePipelineService pipelineService;
    private final AutoRebalanceService autoRebalanceService;
    private final PerformanceLogger performanceLogger;
    private final ObjectMapper objectMapper;

    @PostMapping
    @Operation(summary = "Create a portfolio with its initial holdings")
    public ResponseEntity<PortfolioResponse> create(@RequestHeader(USER_HEADER) String userId,
                                                    @Valid @RequestBody CreatePortfolioRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PortfolioResponse.from(portfolioService.create(userId, request)));
    }

    @GetMapping
    @Operation(summary = "List the caller's portfolios")
    public List<PortfolioResponse> list(@RequestHeader(USER_HEADER) String userId) {
        return portfolioService.list(userId).stream().map(PortfolioResponse::from).toList();
    }

    @GetMapping("/{portfolioId}")
    @Operation(summary = "Get a portfolio")
    public PortfolioResponse get(@RequestHeader(USER_HEADER) String userId, @PathVariable Long portfolioId) {
        return PortfolioResponse.from(portfolioService.get(userId, portfolioId));
    }

    @GetMapping("/{portfolioId}/analysis")
    @Operation(summary = "Analyze a portfolio without trading")
    public AnalysisResult analyze(@RequestHeader(USER_HEADER) String userId, @PathVariable Long portfolioId) {
        return pipelineService.analyze(userId, portfolioId);
    }

    @PostMapping("/{portfolioId}/rebalance")
    @Operation(summary = "Run the rebalance pipeline, optionally as a dry run")
    public RebalanceResult rebalance(@RequestHeader(USER_HEADER) String userId,
                                     @PathVariable Long portfolioId,
                                     @Valid @RequestBody(required = false) RebalanceRequest request) {
        RebalanceRequest effective = request != null ? request : new RebalanceRequest(false, null);
        return pipelineService.rebalance(userId, portfolioId, effective.dryRun(), effective.maxSlippagePercent(),
                RebalanceTrigger.USER);
    }

    @DeleteMapping("/{portfolioId}/rebalance")
    @Operation(summary = "Cancel an in-flight rebalance")
    public Map<String, Object> cancel(@RequestHeader(USER_HEADER) String userId, @PathVariable Long portfolioId) {
        boolean cancelled = pipelineService.cancel(userId, portfolioId);
        return Map.of("portfolioId", portfolioId, "cancellationRequested", cancelled);
    }

    @PostMapping("/{portfolioId}/simulate")
    @Operation(summary = "Simulate a custom target allocation")
    public SimulationResult simulate(@RequestHeader(USER_HEADER) String userId,
                                     @PathVariable Long portfolioId,
                                     @Valid @RequestBody SimulateRequest request) {
        return pipelineService.simulate(userId, portfolioId, request.targetAllocations());
    }

    @GetMapping("/{portfolioId}/events")
    @Operation(summary = "Rebalance events, most recent first")
    public List<RebalanceEventResponse> events(@RequestHeader(USER_HEADER) String userId,
                                               @PathVariable Long portfolioId,
                                               @RequestParam(required = false) String type,
                                               @RequestParam(defaultValue = "20") @Min(1) @Max(200) int limit) {
        portfolioService.get(userId, portfolioId);
        RebalanceEventType eventType = null;
        if (type != null && !type.isBlank()) {
            eventType = RebalanceEventType.fromCode(type)
                    .orElseThrow(() -> new BadRequestException("Unknown event type: " + type));
        }
        return performanceLogger.recentEvents(portfolioId, eventType, limit).stream()
                .map(this::toResponse)
                .toList();
    }

    @GetMapping("/{portfolioId}/performance")
    @Operation(summary = "Rebalance performance over the last days")
    public PerformanceSummary performance(@RequestHeader(USER_HEADER) String userId,
                                          @PathVariable Long portfolioId,
                                          @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days) {
        portfolioService.get(userId, portfolioId);
        return performanceLogger.summarize(portfolioId, days);
    }

    @GetMapping("/{portfolioId}/auto-rebalance")
    @Operation(summary = "Auto-rebalance status")
    public AutoRebalanceStatus autoRebalanceStatus(@RequestHeader(USER_HEADER) String userId,
                                                   @PathVariable Long portfolioId) {
        return autoRebalanceService.status(userId, portfolioId);
    }

    @PutMapping("/{portfolioId}/auto-rebalance")
    @Operation(summary = "Enable auto-rebalance")
    public AutoRebalanceStatus enableAutoRebalance(@RequestHeader(USER_HEADER) String userId,
                                                   @PathVariable Long portfolioId,
                                                   @Valid @RequestBody AutoRebalanceRequest request) {
        return autoRebalanceService.enable(userId, portfolioId, request.frequency(), request.maxSlippage());
    }

    @DeleteMapping("/{portfolioId}/auto-rebalance")
    @Operation(summary = "Disable auto-rebalance")
    public AutoRebalanceStatus disableAutoRebalance(@RequestHeader(USER_HEADER) String userId,
                                                    @PathVariable Long portfolioId) {
        return autoRebalanceService.disable(userId, portfolioId);
    }

    private RebalanceEventResponse toResponse(RebalanceEvent event) {
        JsonNode details = null;
        if (event.getDetails() != null) {
            try {
                details = objectMapper.readTree(event.getDetails());
            } catch (Exception e) {
                log.warn("Unreadable details on rebalance event {}", event.getId());
                details = objectMapper.getNodeFactory().textNode(event.getDetails());
            }
        }
        return new RebalanceEventResponse(event.getId(), event.getPortfolioId(), event.getEventType(), details,
                event.getCreatedAt());
    }
}
