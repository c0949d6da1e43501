package com.aitrader.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "exchange")
@Data
@Validated
public class ExchangeProperties {

    @Min(1)
    private long connectTimeoutSeconds = 10;

    @Min(1)
    private long readTimeoutSeconds = 30;

    @Min(1)
    private long recvWindowMillis = 5000;

    @Valid
    private Endpoint binance = new Endpoint("https://fapi.binance.com", "https://testnet.binancefuture.com");

    @Valid
    private Endpoint gate = new Endpoint("https://api.gateio.ws", "https://fx-api-testnet.gateio.ws");

    @Data
    public static class Endpoint {
        @NotBlank
        private String mainnetUrl;

        @NotBlank
        private String testnetUrl;

        public Endpoint() {
        }

        public Endpoint(String mainnetUrl, String testnetUrl) {
            this.mainnetUrl = mainnetUrl;
            this.testnetUrl = testnetUrl;
        }

        public String resolve(boolean testnet) {
            return testnet ? testnetUrl : mainnetUrl;
        }
    }
}
