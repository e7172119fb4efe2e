package com.exitbot.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One conversation sent to a provider.
 *
 * Immutable once built. {@code model}, {@code temperature} and {@code maxTokens}
 * may be left null, in which case the provider's configured defaults apply.
 */
@Value
@Builder(toBuilder = true)
public class LlmRequest {

    @Singular
    List<Message> messages;

    String model;
    Double temperature;
    Integer maxTokens;

    public Message lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).getRole() == Message.Role.user) {
                return messages.get(i);
            }
        }
        return null;
    }
}
