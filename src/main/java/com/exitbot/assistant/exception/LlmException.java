package com.exitbot.assistant.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The only exception type that leaves the LLM layer.
 * Retry and breaker decisions are made on {@link #getKind()}, never on the cause type.
 */
@Getter
public class LlmException extends RuntimeException {

    private final ErrorKind kind;
    private final String provider;

    /** Provider backpressure hint (Retry-After); null when absent */
    private final Duration retryAfter;

    public LlmException(ErrorKind kind, String provider, String message) {
        this(kind, provider, message, null, null);
    }

    public LlmException(ErrorKind kind, String provider, String message, Throwable cause) {
        this(kind, provider, message, null, cause);
    }

    public LlmException(ErrorKind kind, String provider, String message,
                        Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
        this.retryAfter = retryAfter;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static LlmException circuitOpen(String provider) {
        return new LlmException(ErrorKind.CIRCUIT_OPEN, provider,
                "Circuit breaker for " + provider + " is OPEN, call rejected");
    }
}
