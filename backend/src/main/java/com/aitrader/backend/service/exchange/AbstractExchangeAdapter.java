package com.aitrader.backend.service.exchange;

import com.aitrader.backend.exception.ExchangeApiException;
import com.aitrader.backend.exception.SymbolNotFoundException;
import com.aitrader.backend.util.PrecisionUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * HTTP plumbing shared by the exchange adapters: a private HTTP client released on
 * {@link #close()}, signing helpers, resilient reads and precision handling.
 */
@Slf4j
public abstract class AbstractExchangeAdapter implements ExchangeAdapter {

    protected final ExchangeCredentials credentials;
    protected final ObjectMapper objectMapper;
    protected final ExchangeClientSupport support;

    private final ExecutorService httpExecutor;
    private final RestTemplate restTemplate;
    private final Retry readRetry;
    private final CircuitBreaker circuitBreaker;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected AbstractExchangeAdapter(ExchangeCredentials credentials, ExchangeClientSupport support) {
        this.credentials = credentials;
        this.support = support;
        this.objectMapper = support.getObjectMapper();
        this.readRetry = support.getExchangeReadRetry();
        this.circuitBreaker = support.getExchangeCircuitBreakers().circuitBreaker(exchange().getId());
        this.httpExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, exchange().getId() + "-http");
            thread.setDaemon(true);
            return thread;
        });
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(support.getProperties().getConnectTimeoutSeconds()))
                .executor(httpExecutor)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofSeconds(support.getProperties().getReadTimeoutSeconds()));
        this.restTemplate = new RestTemplate(requestFactory);
    }

    protected abstract SymbolInfo fetchSymbolInfo(String symbol);

    @Override
    public SymbolInfo getSymbolInfo(String symbol) {
        SymbolInfoCache cache = support.getSymbolInfoCache();
        return cache.get(exchange(), credentials.testnet(), symbol).orElseGet(() -> {
            SymbolInfo info = fetchSymbolInfo(symbol);
            cache.put(exchange(), credentials.testnet(), symbol, info);
            return info;
        });
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            httpExecutor.shutdownNow();
            log.debug("{} adapter closed", exchange().getId());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Idempotent read, retried on transient failures and guarded by the exchange circuit breaker.
     */
    protected JsonNode read(Supplier<JsonNode> call) {
        Supplier<JsonNode> decorated = Retry.decorateSupplier(readRetry, call);
        decorated = CircuitBreaker.decorateSupplier(circuitBreaker, decorated);
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw new ExchangeApiException(exchange().getId() + " circuit breaker open", e);
        }
    }

    protected JsonNode send(HttpMethod method, String pathAndQuery, HttpHeaders headers, String body) {
        if (closed.get()) {
            throw new IllegalStateException(exchange().getId() + " adapter already closed");
        }
        String url = credentials.baseUrl() + pathAndQuery;
        try {
            ResponseEntity<String> response = restTemplate.exchange(URI.create(url), method,
                    new HttpEntity<>(body, headers), String.class);
            return parse(response.getBody());
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String responseBody = e.getResponseBodyAsString();
            throw new ExchangeApiException(exchange().getId() + " API error (" + status + "): " + responseBody,
                    status, responseBody, e);
        } catch (ResourceAccessException e) {
            log.warn("{} network error for {} {}: {}", exchange().getId(), method, pathAndQuery, e.getMessage());
            throw new ExchangeApiException(exchange().getId() + " network error: " + e.getMessage(), e);
        }
    }

    protected JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException(exchange().getId() + " returned malformed JSON", e);
        }
    }

    protected String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    /**
     * Converts a placement failure into the uniform result. The exchange's own error code
     * wins over the HTTP status when the body carries one.
     */
    protected OrderResult failure(ExchangeApiException e) {
        String code = e.getStatusCode() > 0 ? String.valueOf(e.getStatusCode()) : "NETWORK";
        String message = e.getResponseBody() != null ? e.getResponseBody() : e.getMessage();
        String exchangeCode = exchangeErrorCode(e.getResponseBody());
        log.warn("{} order rejected code={} message={}", exchange().getId(), exchangeCode != null ? exchangeCode : code, message);
        return OrderResult.failure(exchangeCode != null ? exchangeCode : code, message);
    }

    protected String exchangeErrorCode(String responseBody) {
        return null;
    }

    protected BigDecimal normalizeQuantity(String symbol, BigDecimal quantity) {
        SymbolInfo info = getSymbolInfo(symbol);
        return PrecisionUtils.roundQuantity(quantity, info.quantityPrecision());
    }

    protected BigDecimal normalizePrice(String symbol, BigDecimal price) {
        SymbolInfo info = getSymbolInfo(symbol);
        return PrecisionUtils.roundPrice(price, info.pricePrecision());
    }

    /**
     * Runs a placement, folding every exchange-side failure into an unsuccessful result.
     */
    protected OrderResult placeSafely(String clientOrderId, Supplier<OrderResult> placement) {
        try {
            return placement.get();
        } catch (ExchangeApiException e) {
            return failure(e);
        } catch (SymbolNotFoundException e) {
            log.warn("{} order {} rejected locally: {}", exchange().getId(), clientOrderId, e.getMessage());
            return OrderResult.failure("SYMBOL_NOT_FOUND", e.getMessage());
        }
    }

    protected long nowMillis() {
        return support.getClock().millis();
    }

    protected static String hmacHex(String algorithm, String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }

    protected static String sha512Hex(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    protected static BigDecimal decimalOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        if (text.isBlank()) {
            return null;
        }
        return new BigDecimal(text);
    }

    protected static BigDecimal decimalOrZero(JsonNode node, String field) {
        BigDecimal value = decimalOrNull(node, field);
        return value == null ? BigDecimal.ZERO : value;
    }

    protected static BigDecimal positiveOrNull(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : null;
    }
}
