package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.RequestEntity;

import java.io.IOException;

public class AnthropicAdapter extends AbstractModelAdapter {

    static final String API_VERSION = "2023-06-01";
    static final String JSON_INSTRUCTION =
            "\n\nYou MUST respond with valid JSON matching this schema. No other text allowed.";

    public AnthropicAdapter(String apiKey, String model, String baseUrl, ModelProperties properties, ObjectMapper objectMapper) {
        super(apiKey, model, baseUrl, properties, objectMapper);
    }

    @Override
    public ModelProvider provider() {
        return ModelProvider.ANTHROPIC;
    }

    @Override
    protected RequestEntity<String> buildRequest(String systemPrompt, String userPrompt, JsonNode jsonSchema) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", properties.getMaxTokens());
        body.put("system", jsonSchema != null ? systemPrompt + JSON_INSTRUCTION : systemPrompt);
        body.putArray("messages").addObject().put("role", "user").put("content", userPrompt);

        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);
        return jsonPost(baseUrl + "/messages", body, headers);
    }

    @Override
    protected ModelResponse parseResponse(JsonNode body) {
        JsonNode text = body.path("content").path(0).path("text");
        if (!text.isTextual()) {
            return missingContent(provider().getId());
        }
        JsonNode usage = body.get("usage");
        return ModelResponse.success(text.asText(), usage == null ? null
                : usage(usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0)));
    }
}
