package com.exitbot.assistant.exception;

/**
 * Shared failure taxonomy for every provider.
 *
 * | Kind            | Retried | Typical cause                          |
 * |-----------------|---------|----------------------------------------|
 * | TRANSIENT       | yes     | timeout, connection reset, 5xx         |
 * | RATE_LIMITED    | yes     | 429 from the provider                  |
 * | AUTH_FAILURE    | no      | 401/403, missing API key               |
 * | INVALID_REQUEST | no      | other 4xx                              |
 * | CIRCUIT_OPEN    | no      | breaker short-circuited the call       |
 * | UNKNOWN         | no      | malformed payload, anything unmapped   |
 */
public enum ErrorKind {
    TRANSIENT(true),
    RATE_LIMITED(true),
    AUTH_FAILURE(false),
    INVALID_REQUEST(false),
    CIRCUIT_OPEN(false),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Kinds the caller should present as "temporarily unavailable" rather than a hard error. */
    public boolean isTemporary() {
        return this == TRANSIENT || this == RATE_LIMITED || this == CIRCUIT_OPEN;
    }
}
