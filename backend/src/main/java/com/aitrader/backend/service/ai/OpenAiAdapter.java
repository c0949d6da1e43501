package com.aitrader.backend.service.ai;

import com.aitrader.backend.config.ModelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.RequestEntity;

import java.io.IOException;

/**
 * Chat completions with JSON output, schema-constrained when a schema is supplied.
 */
public class OpenAiAdapter extends AbstractModelAdapter {

    public OpenAiAdapter(String apiKey, String model, String baseUrl, ModelProperties properties, ObjectMapper objectMapper) {
        super(apiKey, model, baseUrl, properties, objectMapper);
    }

    @Override
    public ModelProvider provider() {
        return ModelProvider.OPENAI;
    }

    @Override
    protected RequestEntity<String> buildRequest(String systemPrompt, String userPrompt, JsonNode jsonSchema) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        body.put("temperature", properties.getTemperature());

        ObjectNode responseFormat = body.putObject("response_format");
        if (jsonSchema != null) {
            responseFormat.put("type", "json_schema");
            ObjectNode schema = responseFormat.putObject("json_schema");
            schema.put("name", "trade_plan");
            schema.put("strict", true);
            schema.set("schema", jsonSchema);
        } else {
            responseFormat.put("type", "json_object");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        return jsonPost(baseUrl + "/chat/completions", body, headers);
    }

    @Override
    protected ModelResponse parseResponse(JsonNode body) {
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return missingContent(provider().getId());
        }
        JsonNode usage = body.get("usage");
        return ModelResponse.success(content.asText(), usage == null ? null
                : usage(usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0)));
    }
}
