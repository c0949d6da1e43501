package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.RequestEntity;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Gemini generateContent. The key travels as a query parameter.
 */
public class GoogleAdapter extends AbstractModelAdapter {

    public GoogleAdapter(String apiKey, String model, String baseUrl, ModelProperties properties, ObjectMapper objectMapper) {
        super(apiKey, model, baseUrl, properties, objectMapper);
    }

    @Override
    public ModelProvider provider() {
        return ModelProvider.GOOGLE;
    }

    @Override
    protected RequestEntity<String> buildRequest(String systemPrompt, String userPrompt, JsonNode jsonSchema) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", userPrompt);
        body.putObject("systemInstruction").putArray("parts").addObject().put("text", systemPrompt);
        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("temperature", properties.getTemperature());
        generationConfig.put("responseMimeType", "application/json");
        if (jsonSchema != null) {
            generationConfig.set("responseSchema", jsonSchema);
        }

        String url = baseUrl + "/models/" + model + ":generateContent?key="
                + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        return jsonPost(url, body, new HttpHeaders());
    }

    @Override
    protected ModelResponse parseResponse(JsonNode body) {
        JsonNode text = body.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            return missingContent(provider().getId());
        }
        JsonNode usage = body.get("usageMetadata");
        return ModelResponse.success(text.asText(), usage == null ? null
                : usage(usage.path("promptTokenCount").asInt(0), usage.path("candidatesTokenCount").asInt(0)));
    }
}
