package com.exitbot.assistant.llm.provider;

import com.exitbot.assistant.llm.LlmProvider;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline provider with canned interview replies.
 * Selected when no cloud API key is configured, so local runs and demos work without network access.
 */
public class MockLlmProvider implements LlmProvider {

    public static final String NAME = "mock";

    private static final String DEFAULT_REPLY =
            "Thank you for sharing your thoughts. Your feedback is valuable to us "
                    + "as we work to improve our workplace environment.";
    private static final String WELCOME_REPLY =
            "Welcome to the exit interview! Please tell me about your experience.";

    private static final Map<String, String> CANNED = new LinkedHashMap<>();
    static {
        CANNED.put("why leaving", "Thank you for sharing that. It's understandable that you're looking for "
                + "new growth opportunities. Could you share more about what specific growth aspects "
                + "you feel were missing in your current role?");
        CANNED.put("satisfied", "I appreciate your candid feedback about your role satisfaction. "
                + "What aspects of your role did you find most fulfilling?");
        CANNED.put("manager", "Thank you for your feedback regarding your manager and team. "
                + "Is there anything specific you think could be done to improve team communication?");
        CANNED.put("improve", "Thank you for these insightful suggestions. Which of these improvements "
                + "do you think would have the biggest positive impact?");
    }

    private static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "poor", "terrible", "difficult", "issue", "problem",
            "frustrating", "disappointing", "unhappy", "quit");
    private static final List<String> POSITIVE_WORDS = List.of(
            "good", "great", "excellent", "awesome", "happy", "satisfied",
            "enjoyed", "positive", "helpful", "growth");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public LlmResponse invoke(LlmRequest request) {
        Message last = request.lastUserMessage();
        String text = last != null ? last.getContent() : "";
        String lower = text.toLowerCase(Locale.ROOT);

        String content;
        if (lower.contains("analyze the sentiment")) {
            content = String.format(Locale.ROOT, "%.2f", scoreSentiment(sentimentSubject(lower)));
        } else if (text.isBlank()) {
            content = WELCOME_REPLY;
        } else {
            content = CANNED.entrySet().stream()
                    .filter(e -> lower.contains(e.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(DEFAULT_REPLY);
        }

        return LlmResponse.builder()
                .content(content)
                .provider(NAME)
                .model(request.getModel() != null ? request.getModel() : NAME)
                .finishReason("stop")
                .build();
    }

    /** The text between "text:" and the closing instruction of the sentiment prompt. */
    static String sentimentSubject(String prompt) {
        int start = prompt.indexOf("text:");
        if (start < 0) return prompt;
        int end = prompt.indexOf("return only", start);
        return prompt.substring(start + "text:".length(), end > start ? end : prompt.length());
    }

    /** Deterministic keyword score in [-1, 1]. */
    static double scoreSentiment(String lower) {
        double score = 0.0;
        for (String w : NEGATIVE_WORDS) {
            if (lower.contains(w)) score -= 0.3;
        }
        for (String w : POSITIVE_WORDS) {
            if (lower.contains(w)) score += 0.3;
        }
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
