package com.aitrader.backend.service.exchange;

/**
 * Decrypted credentials and endpoint for one adapter instance.
 */
public record ExchangeCredentials(String apiKey, String apiSecret, String baseUrl, boolean testnet) {

    @Override
    public String toString() {
        return "ExchangeCredentials[baseUrl=" + baseUrl + ", testnet=" + testnet + "]";
    }
}
