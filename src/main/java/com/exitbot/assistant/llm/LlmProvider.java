package com.exitbot.assistant.llm;

import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;

/**
 * One upstream language-model endpoint behind a uniform call signature.
 * Adapters, the retry layer and the breaker layer all implement this.
 */
public interface LlmProvider {

    String getName();

    /**
     * Send one conversation upstream.
     *
     * @throws com.exitbot.assistant.exception.LlmException tagged with the failure kind
     */
    LlmResponse invoke(LlmRequest request);
}
