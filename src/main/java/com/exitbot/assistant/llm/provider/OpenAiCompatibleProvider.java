package com.exitbot.assistant.llm.provider;

import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI chat-completions adapter. Works with Groq and OpenAI.
 */
@Slf4j
public class OpenAiCompatibleProvider extends AbstractHttpLlmProvider {

    public OpenAiCompatibleProvider(String providerName,
                                    LlmProperties.Provider props,
                                    RestClient.Builder restClientBuilder) {
        super(providerName, props, restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build());
    }

    @Override
    protected String endpoint() {
        return "/chat/completions";
    }

    @Override
    protected void checkCredentials() {
        if (!props.hasApiKey()) {
            throw new LlmException(ErrorKind.AUTH_FAILURE, providerName,
                    providerName + " API key is not set. Check your "
                            + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
    }

    @Override
    protected Map<String, Object> buildRequestBody(LlmRequest request) {
        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", resolveModel(request));
        body.put("max_tokens", resolveMaxTokens(request));
        body.put("temperature", resolveTemperature(request));
        body.put("messages", messages);
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent());
        return m;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw malformed("no choices");
        }

        Map<String, Object> choice  = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        if (message == null) {
            throw malformed("choice has no message");
        }

        String content = (String) message.get("content");
        if (content == null || content.isBlank()) {
            log.warn("{} returned empty message content", providerName);
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        int promptTokens     = intValue(usage, "prompt_tokens");
        int completionTokens = intValue(usage, "completion_tokens");
        log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);

        return LlmResponse.builder()
                .content(content != null ? content : "")
                .model((String) response.get("model"))
                .finishReason((String) choice.get("finish_reason"))
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
