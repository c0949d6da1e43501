package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared request/response handling for the vendor adapters. Each instance owns a private
 * {@link RestTemplate} on a JDK client whose executor is released by {@link #close()}.
 */
@Slf4j
public abstract class AbstractModelAdapter implements ModelAdapter {

    private static final int MAX_ERROR_LENGTH = 200;

    protected final String apiKey;
    protected final String model;
    protected final String baseUrl;
    protected final ModelProperties properties;
    protected final ObjectMapper objectMapper;

    private final ExecutorService httpExecutor;
    private final RestTemplate restTemplate;

    protected AbstractModelAdapter(String apiKey, String model, String baseUrl,
                                   ModelProperties properties, ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, provider().getId() + "-http");
            thread.setDaemon(true);
            return thread;
        });
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .executor(httpExecutor)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()));
        this.restTemplate = new RestTemplate(requestFactory);
    }

    /**
     * Builds the vendor request for one generation.
     */
    protected abstract RequestEntity<String> buildRequest(String systemPrompt, String userPrompt, JsonNode jsonSchema)
            throws IOException;

    /**
     * Extracts the text and normalized usage from a 200 response.
     */
    protected abstract ModelResponse parseResponse(JsonNode body);

    @Override
    public ModelResponse generate(String systemPrompt, String userPrompt, JsonNode jsonSchema) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    buildRequest(systemPrompt, userPrompt, jsonSchema), String.class);
            String body = response.getBody() == null ? "" : response.getBody();
            int status = response.getStatusCode().value();
            if (status != 200) {
                return httpFailure(status, body);
            }
            return parseResponse(objectMapper.readTree(body));
        } catch (HttpStatusCodeException e) {
            return httpFailure(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.warn("{} request timed out after {}s", provider().getId(), properties.getTimeoutSeconds());
                return ModelResponse.failure(ModelErrorType.TIMEOUT, "Request timed out");
            }
            log.warn("{} network error: {}", provider().getId(), e.getMessage());
            return ModelResponse.failure(ModelErrorType.NETWORK, truncate(String.valueOf(e.getMessage())));
        } catch (IOException | RestClientException e) {
            return ModelResponse.failure(ModelErrorType.NETWORK, truncate(String.valueOf(e.getMessage())));
        }
    }

    @Override
    public void close() {
        httpExecutor.shutdownNow();
    }

    private ModelResponse httpFailure(int status, String body) {
        ModelErrorType type = classifyError(status, body);
        log.warn("{} returned {} ({})", provider().getId(), status, type);
        return ModelResponse.failure(type, truncate(body));
    }

    static boolean isTimeout(ResourceAccessException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    public static ModelErrorType classifyError(int statusCode, String responseText) {
        String text = responseText == null ? "" : responseText.toLowerCase(Locale.ROOT);
        if (statusCode == 401) {
            return ModelErrorType.AUTH;
        }
        if (statusCode == 429) {
            return text.contains("quota") ? ModelErrorType.QUOTA : ModelErrorType.RATE_LIMIT;
        }
        if (statusCode == 408 || text.contains("timeout")) {
            return ModelErrorType.TIMEOUT;
        }
        return ModelErrorType.UNKNOWN;
    }

    protected RequestEntity<String> jsonPost(String url, ObjectNode body, HttpHeaders headers) throws IOException {
        return RequestEntity.post(URI.create(url))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(objectMapper.writeValueAsString(body));
    }

    protected static Map<String, Integer> usage(int inputTokens, int outputTokens) {
        Map<String, Integer> usage = new LinkedHashMap<>();
        usage.put("input_tokens", inputTokens);
        usage.put("output_tokens", outputTokens);
        usage.put("total_tokens", inputTokens + outputTokens);
        return usage;
    }

    /**
     * A 200 whose payload lacks the expected text is reported as invalid output.
     */
    protected static ModelResponse missingContent(String providerId) {
        return ModelResponse.failure(ModelErrorType.INVALID_OUTPUT, providerId + " response had no content");
    }

    protected static String truncate(String text) {
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
