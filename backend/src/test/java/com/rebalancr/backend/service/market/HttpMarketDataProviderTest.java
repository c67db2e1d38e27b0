package com.rebalancr.backend.service.market;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebalancr.backend.config.SignalProperties;
import com.rebalancr.backend.config.SignalSourceResilienceConfig;
import com.rebalancr.backend.exception.SignalSourceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpMarketDataProviderTest {

    private MockRestServiceServer server;
    private HttpMarketDataProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        SignalSourceResilienceConfig resilience = new SignalSourceResilienceConfig();
        SignalSourceHttpClient client = new SignalSourceHttpClient(
                resilience.signalSourceCircuitBreaker(50, 30, 20),
                resilience.signalSourceRateLimiter(100, 500),
                resilience.signalSourceRetry(1, 1, 0.0),
                new ObjectMapper(),
                new SimpleMeterRegistry());
        SignalProperties properties = new SignalProperties();
        properties.getMarket().setBaseUrl("http://market.test");
        provider = new HttpMarketDataProvider(client, restTemplate, properties);
    }

    @Test
    void latestPriceIsReadFromPriceField() {
        server.expect(requestTo("http://market.test/v1/prices/BTC"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"symbol\":\"BTC\",\"price\":50000.5}", MediaType.APPLICATION_JSON));

        assertThat(provider.latestPrice("BTC")).hasValue(50000.5);
    }

    @Test
    void missingOrNonPositivePriceIsEmpty() {
        server.expect(requestTo("http://market.test/v1/prices/XYZ"))
                .andRespond(withSuccess("{\"price\":0}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://market.test/v1/prices/ABC"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(provider.latestPrice("XYZ")).isEmpty();
        assertThat(provider.latestPrice("ABC")).isEmpty();
    }

    @Test
    void historySkipsNonNumericEntries() {
        server.expect(requestTo("http://market.test/v1/prices/ETH/history?bars=5"))
                .andRespond(withSuccess("{\"prices\":[2500, 2510.5, null, \"bad\", 2490]}", MediaType.APPLICATION_JSON));

        assertThat(provider.priceHistory("ETH", 5)).containsExactly(2500.0, 2510.5, 2490.0);
    }

    @Test
    void socialPostsAreJoinedLineByLine() {
        server.expect(requestTo("http://market.test/v1/social/SOL"))
                .andRespond(withSuccess("{\"posts\":[{\"text\":\"SOL breaking out\"},{\"text\":\"\"},"
                        + "{\"text\":\"validators down again\"}]}", MediaType.APPLICATION_JSON));

        assertThat(provider.socialContent("SOL")).isEqualTo("SOL breaking out\nvalidators down again");
    }

    @Test
    void clientErrorsBecomeSourceFailures() {
        server.expect(requestTo("http://market.test/v1/prices/NOPE"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> provider.latestPrice("NOPE"))
                .isInstanceOf(SignalSourceException.class)
                .hasMessageContaining("market returned 404");
    }
}
