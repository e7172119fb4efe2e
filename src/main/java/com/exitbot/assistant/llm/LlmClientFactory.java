package com.exitbot.assistant.llm;

import com.exitbot.assistant.cache.CacheKeyGenerator;
import com.exitbot.assistant.cache.ResponseCache;
import com.exitbot.assistant.config.HttpClientConfig;
import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.llm.provider.MockLlmProvider;
import com.exitbot.assistant.llm.provider.OllamaProvider;
import com.exitbot.assistant.llm.provider.OpenAiCompatibleProvider;
import com.exitbot.assistant.resilience.CircuitBreakingLlmProvider;
import com.exitbot.assistant.resilience.ProviderCircuitBreaker;
import com.exitbot.assistant.resilience.ResilientLlmClient;
import com.exitbot.assistant.resilience.RetryingLlmProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Builds and memoizes one fully wrapped client per provider:
 * adapter -> retry -> circuit breaker -> response cache.
 *
 * Repeated lookups for the same provider return the same instance, so every caller
 * in the process shares that provider's breaker state and cache.
 */
@Slf4j
public class LlmClientFactory {

    private final LlmProperties props;
    private final HttpClientConfig httpClientConfig;
    private final CacheKeyGenerator keyGenerator;
    private final Clock clock;

    private final ConcurrentMap<ProviderType, LlmClient> clients = new ConcurrentHashMap<>();

    public LlmClientFactory(LlmProperties props,
                            HttpClientConfig httpClientConfig,
                            CacheKeyGenerator keyGenerator,
                            Clock clock) {
        this.props = props;
        this.httpClientConfig = httpClientConfig;
        this.keyGenerator = keyGenerator;
        this.clock = clock;
    }

    public LlmClient getClient(String providerName) {
        return getClient(ProviderType.fromName(providerName));
    }

    public LlmClient getClient(ProviderType type) {
        return clients.computeIfAbsent(type, this::build);
    }

    /** The configured provider's client; cloud providers without an API key fall back to mock. */
    public LlmClient activeClient() {
        return getClient(activeType());
    }

    public ProviderType activeType() {
        ProviderType configured = ProviderType.fromName(props.getProvider());
        if (configured.isCloud() && !settingsFor(configured).hasApiKey()) {
            log.warn("No API key configured for {}, using the mock provider instead",
                    configured.providerName());
            return ProviderType.MOCK;
        }
        return configured;
    }

    /** Clients built so far. */
    public Collection<LlmClient> builtClients() {
        return List.copyOf(clients.values());
    }

    private LlmClient build(ProviderType type) {
        String name = type.providerName();
        LlmProvider adapter = createAdapter(type);

        LlmProperties.CircuitBreaker cb = props.getCircuitBreaker();
        ProviderCircuitBreaker breaker = new ProviderCircuitBreaker(
                name, cb.getFailureThreshold(), cb.getCoolDown(), cb.getHalfOpenSuccessThreshold(), clock);

        LlmProperties.Cache cacheProps = props.getCache();
        ResponseCache cache = new ResponseCache(
                name, cacheProps.isEnabled(), cacheProps.getTtl(), cacheProps.getMaxEntries(), clock);

        log.info("Built LLM client [provider={}, maxRetries={}, failureThreshold={}, coolDown={}, cacheTtl={}]",
                name, props.getRetry().getMaxRetries(), cb.getFailureThreshold(), cb.getCoolDown(),
                cacheProps.isEnabled() ? cacheProps.getTtl() : "disabled");

        return new ResilientLlmClient(
                new CircuitBreakingLlmProvider(new RetryingLlmProvider(adapter, props.getRetry()), breaker),
                cache,
                keyGenerator);
    }

    /** Raw adapter for a provider. Overridable so tests can plug in a scripted upstream. */
    protected LlmProvider createAdapter(ProviderType type) {
        LlmProperties.Provider settings = settingsFor(type);
        return switch (type) {
            case GROQ, OPENAI -> new OpenAiCompatibleProvider(type.providerName(), settings,
                    httpClientConfig.restClientBuilder(settings.getConnectTimeout(), settings.getReadTimeout()));
            case OLLAMA -> new OllamaProvider(type.providerName(), settings,
                    httpClientConfig.restClientBuilder(settings.getConnectTimeout(), settings.getReadTimeout()));
            case MOCK -> new MockLlmProvider();
        };
    }

    private LlmProperties.Provider settingsFor(ProviderType type) {
        return switch (type) {
            case GROQ -> props.getGroq();
            case OPENAI -> props.getOpenai();
            case OLLAMA -> props.getOllama();
            case MOCK -> new LlmProperties.Provider();
        };
    }
}
