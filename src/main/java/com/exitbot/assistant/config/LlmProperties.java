package com.exitbot.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the LLM layer.
 * Bound from application.yml under the "llm" prefix.
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** Active provider: groq, openai, ollama or mock */
    private String provider = "groq";

    private Provider groq = new Provider();
    private Provider openai = new Provider();
    private Provider ollama = new Provider();

    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Cache cache = new Cache();
    private Interview interview = new Interview();

    @Data
    public static class Provider {
        private String apiKey = "";
        private String baseUrl = "";
        private String model = "";
        private int maxTokens = 1024;
        private double temperature = 0.7;
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** Per-call bound on the upstream round-trip */
        private Duration readTimeout = Duration.ofSeconds(30);

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Retry {
        /** Retries after the first attempt */
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        /** 0 disables jitter; 0.5 spreads each delay over ±50% */
        private double jitterFactor = 0.0;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(60);
        private int halfOpenSuccessThreshold = 1;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(10);
        private int maxEntries = 100;
    }

    @Data
    public static class Interview {
        private String systemPrompt =
                "You are a friendly, professional HR assistant conducting an exit interview. "
                        + "Ask one concise question at a time and acknowledge the employee's answers.";
        private String fallbackReply =
                "I'm having trouble connecting to my knowledge base. Please try again in a minute.";
        private String sentimentPrompt =
                "Analyze the sentiment of the following text and return ONLY a float value "
                        + "between -1.0 (negative) and 1.0 (positive).\n\nText: %s\n\n"
                        + "Return only the float value and nothing else.";
        private String analysisPrompt =
                "You are an AI analyst specialized in reviewing exit interview data. "
                        + "Analyze the interview that follows and provide:\n"
                        + "1. An executive summary of the key findings\n"
                        + "2. The employee's experience by theme (management, culture, role, "
                        + "compensation, career growth)\n"
                        + "3. Recommendations for the organization\n"
                        + "4. Retention risks that may apply to other employees";
        private double analysisTemperature = 0.3;
        private String analysisUnavailable =
                "Interview analysis is temporarily unavailable. Please try again later.";
    }
}
