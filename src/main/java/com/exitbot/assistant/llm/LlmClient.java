package com.exitbot.assistant.llm;

import com.exitbot.assistant.cache.CacheStats;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.resilience.CircuitStatus;

/**
 * Fully wrapped client for one provider: cache -> circuit breaker -> retry -> adapter.
 */
public interface LlmClient {

    String getProviderName();

    /**
     * Send the full conversation to the provider, or serve it from the cache.
     *
     * @throws com.exitbot.assistant.exception.LlmException when the call fails after retries,
     *         or immediately with CIRCUIT_OPEN when the provider is unhealthy
     */
    LlmResponse chat(LlmRequest request);

    CircuitStatus getCircuitStatus();

    void resetCircuit();

    void clearCache();

    CacheStats getCacheStats();
}
