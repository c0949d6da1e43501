package com.aitrader.backend.service.exchange;

import com.aitrader.backend.config.ExchangeProperties;
import com.aitrader.backend.model.ExchangeAccount;
import com.aitrader.backend.service.secrets.SecretsCrypto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a fresh adapter per unit of work. Callers close it with try-with-resources.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExchangeAdapterFactory {

    private final SecretsCrypto secretsCrypto;
    private final ExchangeClientSupport support;

    /**
     * @throws com.aitrader.backend.exception.UnsupportedExchangeException for an unknown exchange id
     * @throws com.aitrader.backend.exception.SecretsException when credentials cannot be decrypted
     */
    public ExchangeAdapter create(ExchangeAccount account) {
        ExchangeType type = ExchangeType.fromString(account.getExchange());
        ExchangeProperties properties = support.getProperties();
        String baseUrl = switch (type) {
            case BINANCE -> properties.getBinance().resolve(account.isTestnet());
            case GATE -> properties.getGate().resolve(account.isTestnet());
        };
        ExchangeCredentials credentials = new ExchangeCredentials(
                secretsCrypto.decrypt(account.getApiKeyEncrypted()),
                secretsCrypto.decrypt(account.getApiSecretEncrypted()),
                baseUrl,
                account.isTestnet());
        log.debug("Creating {} adapter for account {} testnet={}", type.getId(), account.getId(), account.isTestnet());
        return create(type, credentials);
    }

    public ExchangeAdapter create(ExchangeType type, ExchangeCredentials credentials) {
        return switch (type) {
            case BINANCE -> new BinanceAdapter(credentials, support);
            case GATE -> new GateAdapter(credentials, support);
        };
    }
}
