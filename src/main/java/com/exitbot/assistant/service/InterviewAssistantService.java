package com.exitbot.assistant.service;

import com.exitbot.assistant.cache.CacheStats;
import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.llm.LlmClient;
import com.exitbot.assistant.llm.LlmClientFactory;
import com.exitbot.assistant.model.InterviewAnalysis;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.model.Message;
import com.exitbot.assistant.model.ReplyOptions;
import com.exitbot.assistant.resilience.CircuitStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point used by the interview request handlers.
 *
 * generateReply propagates {@link LlmException}; generateReplyOrFallback turns any
 * failure into the configured "temporarily unavailable" reply so a request never
 * crashes because the model is down.
 */
@Service
@Slf4j
public class InterviewAssistantService {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final double NEUTRAL = 0.0;

    private final LlmClient llmClient;
    private final LlmClientFactory clientFactory;
    private final LlmProperties.Interview interview;
    private final Clock clock;

    public InterviewAssistantService(@Qualifier("activeLlmClient") LlmClient llmClient,
                                     LlmClientFactory clientFactory,
                                     LlmProperties props,
                                     Clock clock) {
        this.llmClient = llmClient;
        this.clientFactory = clientFactory;
        this.interview = props.getInterview();
        this.clock = clock;
    }

    public String generateReply(List<Message> history, ReplyOptions options) {
        ReplyOptions opts = options != null ? options : ReplyOptions.DEFAULTS;

        LlmRequest.LlmRequestBuilder request = LlmRequest.builder()
                .model(opts.getModel())
                .temperature(opts.getTemperature())
                .maxTokens(opts.getMaxTokens());

        boolean hasSystemPrompt = history.stream().anyMatch(m -> m.getRole() == Message.Role.system);
        if (!hasSystemPrompt) {
            request.message(Message.system(interview.getSystemPrompt()));
        }
        request.messages(history);

        LlmResponse response = llmClient.chat(request.build());
        log.debug("Reply generated by {} [tokens={}, latencyMs={}]",
                response.getProvider(), response.getTotalTokens(), response.getLatencyMs());
        return response.getContent();
    }

    /** Degrades to the fallback reply instead of throwing. */
    public LlmResponse generateReplyOrFallback(List<Message> history, ReplyOptions options) {
        try {
            return LlmResponse.builder()
                    .provider(llmClient.getProviderName())
                    .content(generateReply(history, options))
                    .build();
        } catch (LlmException e) {
            log.warn("Assistant unavailable [{} from {}]: {}", e.getKind(), e.getProvider(), e.getMessage());
            return LlmResponse.failure(llmClient.getProviderName(), e.getKind(), interview.getFallbackReply());
        }
    }

    /**
     * Sentiment of an employee answer in [-1.0, 1.0]. Returns neutral (0.0) when the
     * model is unavailable or answers with something that is not a number.
     */
    public double analyzeSentiment(String text) {
        if (text == null || text.isBlank()) {
            return NEUTRAL;
        }
        LlmRequest request = LlmRequest.builder()
                .message(Message.user(String.format(interview.getSentimentPrompt(), text)))
                .temperature(0.0)
                .build();
        try {
            return parseSentiment(llmClient.chat(request).getContent());
        } catch (LlmException e) {
            log.error("Error analyzing sentiment [{}]: {}", e.getKind(), e.getMessage());
            return NEUTRAL;
        }
    }

    /**
     * Review of a completed interview. The analyst prompt replaces any interviewer system
     * prompt in the history. Never throws on provider failure: the result then carries the
     * error kind and the configured "unavailable" notice.
     */
    public InterviewAnalysis analyzeInterview(List<Message> history) {
        List<Message> transcript = history.stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .toList();
        InterviewAnalysis.InterviewAnalysisBuilder result = InterviewAnalysis.builder()
                .interviewLength(transcript.size())
                .provider(llmClient.getProviderName());

        if (transcript.isEmpty()) {
            return result.analysis("").timestamp(Instant.now(clock)).build();
        }

        LlmRequest request = LlmRequest.builder()
                .message(Message.system(interview.getAnalysisPrompt()))
                .messages(transcript)
                .temperature(interview.getAnalysisTemperature())
                .build();
        try {
            LlmResponse response = llmClient.chat(request);
            log.info("Interview analysed by {} [messages={}, tokens={}]",
                    response.getProvider(), transcript.size(), response.getTotalTokens());
            result.analysis(response.getContent());
        } catch (LlmException e) {
            log.error("Interview analysis failed [{} from {}]: {}", e.getKind(), e.getProvider(), e.getMessage());
            result.analysis(interview.getAnalysisUnavailable()).errorKind(e.getKind());
        }
        return result.timestamp(Instant.now(clock)).build();
    }

    static double parseSentiment(String raw) {
        if (raw == null) {
            return NEUTRAL;
        }
        String trimmed = raw.trim();
        double score;
        try {
            score = Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            Matcher m = NUMBER.matcher(trimmed);
            if (!m.find()) {
                log.warn("Could not extract sentiment value from response: {}", trimmed);
                return NEUTRAL;
            }
            score = Double.parseDouble(m.group());
        }
        if (Double.isNaN(score)) {
            return NEUTRAL;
        }
        return Math.max(-1.0, Math.min(1.0, score));
    }

    public CircuitStatus getCircuitStatus(String providerName) {
        return clientFactory.getClient(providerName).getCircuitStatus();
    }

    public void resetCircuit(String providerName) {
        clientFactory.getClient(providerName).resetCircuit();
    }

    /** Clears the cache of every provider built so far. */
    public void clearCache() {
        clientFactory.builtClients().forEach(LlmClient::clearCache);
        log.info("LLM response caches cleared");
    }

    public List<CacheStats> cacheStats() {
        return clientFactory.builtClients().stream()
                .map(LlmClient::getCacheStats)
                .toList();
    }

    public String activeProvider() {
        return llmClient.getProviderName().toLowerCase(Locale.ROOT);
    }
}
