package com.exitbot.assistant.llm;

import com.exitbot.assistant.exception.UnknownProviderException;

import java.util.Arrays;
import java.util.Locale;

public enum ProviderType {
    GROQ(true),
    OPENAI(true),
    OLLAMA(false),
    MOCK(false);

    private final boolean cloud;

    ProviderType(boolean cloud) {
        this.cloud = cloud;
    }

    /** Cloud providers need an API key; local ones do not. */
    public boolean isCloud() {
        return cloud;
    }

    public String providerName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProviderType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownProviderException("Provider name must not be blank");
        }
        return Arrays.stream(values())
                .filter(t -> t.providerName().equals(name.trim().toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new UnknownProviderException(
                        "Unknown LLM provider '" + name + "'. Supported: groq, openai, ollama, mock"));
    }
}
