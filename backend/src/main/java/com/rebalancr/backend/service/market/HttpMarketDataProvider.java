package com.rebalancr.backend.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalancr.backend.config.SignalProperties;
import com.rebalancr.backend.rebalance.MarketDataProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

@Service
public class HttpMarketDataProvider implements MarketDataProvider {

    static final String SOURCE = "market";

    private final SignalSourceHttpClient httpClient;
    private final RestTemplate restTemplate;
    private final SignalProperties signalProperties;

    public HttpMarketDataProvider(SignalSourceHttpClient httpClient,
                                  @Qualifier("marketRestTemplate") RestTemplate restTemplate,
                                  SignalProperties signalProperties) {
        this.httpClient = httpClient;
        this.restTemplate = restTemplate;
        this.signalProperties = signalProperties;
    }

    @Override
    public OptionalDouble latestPrice(String symbol) {
        JsonNode response = httpClient.get(SOURCE, restTemplate, baseUrl() + "/v1/prices/" + symbol, apiKey());
        JsonNode price = response.get("price");
        if (price == null || !price.isNumber() || price.asDouble() <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(price.asDouble());
    }

    @Override
    public List<Double> priceHistory(String symbol, int bars) {
        JsonNode response = httpClient.get(SOURCE, restTemplate,
                baseUrl() + "/v1/prices/" + symbol + "/history?bars=" + bars, apiKey());
        List<Double> prices = new ArrayList<>();
        for (JsonNode price : response.path("prices")) {
            if (price.isNumber()) {
                prices.add(price.asDouble());
            }
        }
        return prices;
    }

    @Override
    public String socialContent(String symbol) {
        JsonNode response = httpClient.get(SOURCE, restTemplate, baseUrl() + "/v1/social/" + symbol, apiKey());
        List<String> texts = new ArrayList<>();
        for (JsonNode post : response.path("posts")) {
            String text = post.path("text").asText("");
            if (!text.isBlank()) {
                texts.add(text);
            }
        }
        return String.join("\n", texts);
    }

    private String baseUrl() {
        return signalProperties.getMarket().getBaseUrl();
    }

    private String apiKey() {
        return signalProperties.getMarket().getApiKey();
    }
}
