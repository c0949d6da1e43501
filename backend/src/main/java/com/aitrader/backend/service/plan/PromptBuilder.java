package com.aitrader.backend.service.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@Component
public class PromptBuilder {

    static final String SYSTEM_PROMPT_RESOURCE = "prompts/system-prompt.txt";

    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public PromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        try (InputStream in = new ClassPathResource(SYSTEM_PROMPT_RESOURCE).getInputStream()) {
            this.systemPrompt = StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SYSTEM_PROMPT_RESOURCE, e);
        }
    }

    public Prompt build(Map<String, Object> signal, Map<String, Object> marketSnapshot,
                        Map<String, Object> riskProfile, Map<String, Object> accountState) {
        StringBuilder user = new StringBuilder("Analyze this trading signal and generate a trade plan:\n\n");
        appendSection(user, "SIGNAL", signal);
        appendSection(user, "MARKET SNAPSHOT", marketSnapshot);
        appendSection(user, "RISK PROFILE", riskProfile);
        appendSection(user, "ACCOUNT STATE", accountState);
        user.append("Generate a trade plan following the schema. Respond with JSON only.");
        return new Prompt(systemPrompt, user.toString());
    }

    private void appendSection(StringBuilder target, String title, Map<String, Object> data) {
        target.append(title).append(":\n").append(pretty(data)).append("\n\n");
    }

    private String pretty(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Prompt section is not serializable", e);
        }
    }

    public record Prompt(String system, String user) {
    }
}
