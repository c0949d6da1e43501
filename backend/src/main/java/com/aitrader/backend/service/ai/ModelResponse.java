package com.aitrader.backend.service.ai;

import java.util.Map;

/**
 * Uniform provider outcome. Usage keys are {@code input_tokens}, {@code output_tokens}
 * and {@code total_tokens}.
 */
public record ModelResponse(
        boolean success,
        String content,
        ModelErrorType errorType,
        String errorMessage,
        Map<String, Integer> usage
) {

    public static ModelResponse success(String content, Map<String, Integer> usage) {
        return new ModelResponse(true, content, null, null, usage);
    }

    public static ModelResponse failure(ModelErrorType errorType, String errorMessage) {
        return new ModelResponse(false, null, errorType, errorMessage, null);
    }

    public Integer totalTokens() {
        return usage == null ? null : usage.get("total_tokens");
    }
}
