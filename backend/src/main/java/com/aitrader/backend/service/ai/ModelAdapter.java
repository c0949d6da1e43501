package com.aitrader.backend.service.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One LLM vendor behind a single call. Implementations never throw for HTTP or
 * transport failures; they come back as typed error responses.
 */
public interface ModelAdapter extends AutoCloseable {

    ModelProvider provider();

    /**
     * @param jsonSchema optional structured-output schema, null for plain JSON mode
     */
    ModelResponse generate(String systemPrompt, String userPrompt, JsonNode jsonSchema);

    @Override
    void close();
}
