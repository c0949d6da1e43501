package com.aitrader.backend.service.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * JSON Schema of the trade plan, for providers that support structured output.
 */
@Component
public class TradePlanSchema {

    static final String RESOURCE = "prompts/trade-plan-schema.json";

    private final JsonNode schema;

    public TradePlanSchema(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            this.schema = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
    }

    /**
     * Returns a copy; callers may embed it in request bodies.
     */
    public JsonNode get() {
        return schema.deepCopy();
    }
}
