package com.exitbot.assistant.resilience;

import com.exitbot.assistant.cache.CacheKeyGenerator;
import com.exitbot.assistant.cache.CacheStats;
import com.exitbot.assistant.cache.ResponseCache;
import com.exitbot.assistant.llm.LlmClient;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache front for a breaker-protected provider.
 *
 * Request flow:
 * 1. Cache hit -> return
 * 2. Breaker OPEN -> CIRCUIT_OPEN, provider untouched
 * 3. Retry transient failures with backoff
 * 4. Success -> cached; failure -> propagated, nothing cached
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final CircuitBreakingLlmProvider provider;
    private final ResponseCache cache;
    private final CacheKeyGenerator keyGenerator;

    public ResilientLlmClient(CircuitBreakingLlmProvider provider,
                              ResponseCache cache,
                              CacheKeyGenerator keyGenerator) {
        this.provider = provider;
        this.cache = cache;
        this.keyGenerator = keyGenerator;
    }

    @Override
    public String getProviderName() {
        return provider.getName();
    }

    @Override
    public LlmResponse chat(LlmRequest request) {
        String key = keyGenerator.keyFor(provider.getName(), request);
        return cache.getOrCompute(key, () -> provider.invoke(request));
    }

    @Override
    public CircuitStatus getCircuitStatus() {
        return provider.getBreaker().status();
    }

    @Override
    public void resetCircuit() {
        log.info("[{}] Circuit breaker reset requested", provider.getName());
        provider.getBreaker().reset();
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    @Override
    public CacheStats getCacheStats() {
        return cache.stats();
    }
}
