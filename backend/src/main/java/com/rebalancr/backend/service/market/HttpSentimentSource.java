package com.rebalancr.backend.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalancr.backend.config.SignalProperties;
import com.rebalancr.backend.exception.SignalSourceException;
import com.rebalancr.backend.model.Sentiment;
import com.rebalancr.backend.rebalance.SentimentReading;
import com.rebalancr.backend.rebalance.SentimentSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class HttpSentimentSource implements SentimentSource {

    static final String SOURCE = "sentiment";
    static final double MANIPULATION_THRESHOLD = 0.6;

    private final SignalSourceHttpClient httpClient;
    private final RestTemplate restTemplate;
    private final SignalProperties signalProperties;

    public HttpSentimentSource(SignalSourceHttpClient httpClient,
                               @Qualifier("sentimentRestTemplate") RestTemplate restTemplate,
                               SignalProperties signalProperties) {
        this.httpClient = httpClient;
        this.restTemplate = restTemplate;
        this.signalProperties = signalProperties;
    }

    @Override
    public SentimentReading analyze(String symbol, String content) {
        if (content == null || content.isBlank()) {
            throw new SignalSourceException(SOURCE, "no social content for " + symbol);
        }
        SignalProperties.Source config = signalProperties.getSentiment();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", content);
        body.put("symbol", symbol);
        JsonNode response = httpClient.post(SOURCE, restTemplate, config.getBaseUrl() + "/v1/sentiment/analyze",
                config.getApiKey(), body);

        double fear = unit(response.path("fear_score").asDouble(0.5));
        double greed = unit(response.path("greed_score").asDouble(0.5));
        double manipulation = unit(response.path("manipulation_score").asDouble(0.5));
        return new SentimentReading(sentimentOf(response.path("sentiment").asText(""), fear, greed), fear, greed,
                manipulation, manipulation > MANIPULATION_THRESHOLD);
    }

    // A tie between fear and greed reads as neutral.
    static Sentiment sentimentOf(String label, double fear, double greed) {
        if ("neutral".equalsIgnoreCase(label.trim())) {
            return Sentiment.NEUTRAL;
        }
        if (fear > greed) {
            return Sentiment.FEAR;
        }
        if (greed > fear) {
            return Sentiment.GREED;
        }
        return Sentiment.NEUTRAL;
    }

    private static double unit(double value) {
        if (Double.isNaN(value)) {
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
