package com.exitbot.assistant.model;

import com.exitbot.assistant.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LlmResponse {

    /** Generated text; the fallback text when {@link #errorKind} is set */
    String content;

    String provider;
    String model;
    String finishReason;

    @Builder.Default
    int promptTokens = 0;

    @Builder.Default
    int completionTokens = 0;

    @Builder.Default
    long latencyMs = 0;

    /** Null on success */
    ErrorKind errorKind;

    public boolean isSuccess() {
        return errorKind == null;
    }

    public int getTotalTokens() {
        return promptTokens + completionTokens;
    }

    public static LlmResponse failure(String provider, ErrorKind kind, String fallbackContent) {
        return LlmResponse.builder()
                .provider(provider)
                .errorKind(kind)
                .content(fallbackContent)
                .build();
    }
}
