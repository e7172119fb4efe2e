package com.exitbot.assistant.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one provider's breaker.
 *
 * @param openedAt when the breaker last opened; null if it never has
 */
public record CircuitStatus(String provider, CircuitState state, int failureCount, Instant openedAt) {
}
