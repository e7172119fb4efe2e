package com.exitbot.assistant.llm;

import com.exitbot.assistant.cache.CacheKeyGenerator;
import com.exitbot.assistant.config.HttpClientConfig;
import com.exitbot.assistant.config.LlmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Wires the client factory and exposes the active provider's client for injection.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class LlmClientConfig {

    private final LlmProperties props;

    @PostConstruct
    public void logActiveProvider() {
        LlmProperties.Provider active = switch (props.getProvider().toLowerCase()) {
            case "openai" -> props.getOpenai();
            case "ollama" -> props.getOllama();
            case "groq" -> props.getGroq();
            default -> null;
        };
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", props.getProvider().toUpperCase());
        if (active != null) {
            log.info("  Model               : {}", active.getModel());
            log.info("  Timeouts            : connect={} read={}", active.getConnectTimeout(), active.getReadTimeout());
            logKey(props.getProvider(), active.getApiKey());
        }
        log.info("================================================================");
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator(ObjectMapper objectMapper) {
        return new CacheKeyGenerator(objectMapper);
    }

    @Bean
    public LlmClientFactory llmClientFactory(HttpClientConfig httpClientConfig,
                                             CacheKeyGenerator cacheKeyGenerator,
                                             Clock clock) {
        return new LlmClientFactory(props, httpClientConfig, cacheKeyGenerator, clock);
    }

    @Bean("activeLlmClient")
    @Primary
    public LlmClient activeLlmClient(LlmClientFactory factory) {
        return factory.activeClient();
    }

    private void logKey(String provider, String key) {
        if ("ollama".equalsIgnoreCase(provider)) {
            return;
        }
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY", provider.toUpperCase(), provider.toUpperCase());
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
