package com.exitbot.assistant.llm.provider;

import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Local Ollama inference server adapter (non-streaming /api/chat).
 */
@Slf4j
public class OllamaProvider extends AbstractHttpLlmProvider {

    static final String DEFAULT_HOST = "http://localhost:11434";

    public OllamaProvider(String providerName,
                          LlmProperties.Provider props,
                          RestClient.Builder restClientBuilder) {
        super(providerName, props, restClientBuilder
                .baseUrl(normalizeHost(props.getBaseUrl()))
                .defaultHeader("Content-Type", "application/json")
                .build());
        log.info("Ollama client initialized [host={}, model={}]",
                normalizeHost(props.getBaseUrl()), props.getModel());
    }

    static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            return DEFAULT_HOST;
        }
        String h = host.trim();
        if (!h.startsWith("http://") && !h.startsWith("https://")) {
            h = "http://" + h;
        }
        while (h.endsWith("/")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    @Override
    protected String endpoint() {
        return "/api/chat";
    }

    @Override
    protected Map<String, Object> buildRequestBody(LlmRequest request) {
        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", resolveTemperature(request));
        options.put("num_predict", resolveMaxTokens(request));

        Map<String, Object> body = new HashMap<>();
        body.put("model", resolveModel(request));
        body.put("messages", messages);
        body.put("stream", false);
        body.put("options", options);
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
        Map<String, Object> message = (Map<String, Object>) response.get("message");
        if (message == null || !(message.get("content") instanceof String content)) {
            throw malformed("missing message.content");
        }

        return LlmResponse.builder()
                .content(content)
                .model((String) response.get("model"))
                .finishReason((String) response.get("done_reason"))
                .promptTokens(intValue(response, "prompt_eval_count"))
                .completionTokens(intValue(response, "eval_count"))
                .build();
    }
}
