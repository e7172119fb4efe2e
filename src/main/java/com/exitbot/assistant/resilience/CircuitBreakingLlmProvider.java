package com.exitbot.assistant.resilience;

import com.exitbot.assistant.llm.LlmProvider;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;

/**
 * Runs the retried provider call through the provider's breaker.
 * Every error that comes out of the retry layer counts as one breaker failure and is rethrown unchanged.
 */
public class CircuitBreakingLlmProvider implements LlmProvider {

    private final LlmProvider delegate;
    private final ProviderCircuitBreaker breaker;

    public CircuitBreakingLlmProvider(LlmProvider delegate, ProviderCircuitBreaker breaker) {
        this.delegate = delegate;
        this.breaker = breaker;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public LlmResponse invoke(LlmRequest request) {
        return breaker.execute(() -> delegate.invoke(request));
    }

    public ProviderCircuitBreaker getBreaker() {
        return breaker;
    }
}
