package com.rebalancr.backend.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalancr.backend.exception.SignalSourceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * JSON calls to external signal sources, wrapped in retry, circuit breaker and rate limiter.
 * Every failure surfaces as a {@link SignalSourceException} naming the source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalSourceHttpClient {

    private final CircuitBreaker signalSourceCircuitBreaker;
    private final RateLimiter signalSourceRateLimiter;
    private final Retry signalSourceRetry;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public JsonNode get(String source, RestTemplate restTemplate, String url, String apiKey) {
        return execute(source, restTemplate, url, HttpMethod.GET, null, apiKey);
    }

    public JsonNode post(String source, RestTemplate restTemplate, String url, String apiKey, Object body) {
        return execute(source, restTemplate, url, HttpMethod.POST, body, apiKey);
    }

    private JsonNode execute(String source, RestTemplate restTemplate, String url, HttpMethod method, Object body,
                             String apiKey) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(restTemplate, url, method, body, apiKey);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(signalSourceRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(signalSourceCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(signalSourceRateLimiter, decorated);
            String response = decorated.get();
            JsonNode node = response == null || response.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response);
            success = true;
            return node;
        } catch (CallNotPermittedException e) {
            throw new SignalSourceException(source, source + " circuit open", e);
        } catch (RequestNotPermitted e) {
            throw new SignalSourceException(source, source + " rate limited", e);
        } catch (HttpStatusCodeException e) {
            throw new SignalSourceException(source, source + " returned " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new SignalSourceException(source, source + " unreachable: " + e.getMessage(), e);
        } catch (SignalSourceException e) {
            throw e;
        } catch (Exception e) {
            throw new SignalSourceException(source, source + " call failed: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("signal_source_latency")
                    .tag("source", source)
                    .tag("outcome", success ? "success" : "failure")
                    .register(meterRegistry));
        }
    }

    private String doRequest(RestTemplate restTemplate, String url, HttpMethod method, Object body, String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        HttpEntity<Object> entity = new HttpEntity<>(body, headers);
        ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
        log.debug("{} {} -> {}", method, url, response.getStatusCode().value());
        return response.getBody();
    }
}
