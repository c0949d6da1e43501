package com.aitrader.backend.service.ai;

import com.aitrader.backend.exception.UnsupportedModelProviderException;

import java.util.Locale;

public enum ModelProvider {
    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    GOOGLE("google");

    private final String id;

    ModelProvider(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static ModelProvider fromString(String provider) {
        if (provider != null) {
            String normalized = provider.trim().toLowerCase(Locale.ROOT);
            for (ModelProvider candidate : values()) {
                if (candidate.id.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new UnsupportedModelProviderException(provider);
    }
}
