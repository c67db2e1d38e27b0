package com.rebalancr.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rebalancrOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Rebalancr Portfolio API")
                        .description("Portfolio analysis, rebalancing and auto-rebalance settings")
                        .version("1.0"));
    }
}
