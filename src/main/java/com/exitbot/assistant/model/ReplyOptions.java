package com.exitbot.assistant.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-turn generation overrides passed by the interview flow.
 * Null fields fall back to the provider configuration.
 */
@Value
@Builder
public class ReplyOptions {

    public static final ReplyOptions DEFAULTS = ReplyOptions.builder().build();

    String model;
    Double temperature;
    Integer maxTokens;
}
