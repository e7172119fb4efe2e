package com.exitbot.assistant.cache;

import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a deterministic cache key: SHA-256 over a canonical JSON rendering of
 * the provider, the ordered messages and the generation parameters.
 */
public class CacheKeyGenerator {

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String keyFor(String provider, LlmRequest request) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("provider", provider);
        canonical.put("model", request.getModel());
        canonical.put("temperature", request.getTemperature());
        canonical.put("maxTokens", request.getMaxTokens());
        canonical.put("messages", formatMessages(request.getMessages()));

        try {
            return sha256(objectMapper.writeValueAsBytes(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize request for cache key", e);
        }
    }

    private List<List<String>> formatMessages(List<Message> messages) {
        return messages.stream()
                .map(m -> List.of(m.getRole().name(), m.getContent()))
                .toList();
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
