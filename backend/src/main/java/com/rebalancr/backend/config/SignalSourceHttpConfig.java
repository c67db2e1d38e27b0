package com.rebalancr.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class SignalSourceHttpConfig {

    @Bean
    public RestTemplate sentimentRestTemplate(SignalProperties signalProperties) {
        return build(signalProperties.getSentiment());
    }

    @Bean
    public RestTemplate marketRestTemplate(SignalProperties signalProperties) {
        return build(signalProperties.getMarket());
    }

    private RestTemplate build(SignalProperties.Source source) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(source.getConnectTimeoutMs());
        factory.setReadTimeout(source.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
