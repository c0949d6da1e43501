package com.aitrader.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI traderOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("AI Trader API")
                        .version("1.0"));
    }
}
