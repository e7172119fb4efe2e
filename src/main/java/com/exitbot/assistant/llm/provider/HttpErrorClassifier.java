package com.exitbot.assistant.llm.provider;

import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;

/**
 * Maps RestClient failures onto the shared {@link ErrorKind} taxonomy.
 *
 * | Upstream condition                  | Kind            |
 * |-------------------------------------|-----------------|
 * | I/O error, connect/read timeout     | TRANSIENT       |
 * | 5xx, 408                            | TRANSIENT       |
 * | 429                                 | RATE_LIMITED    |
 * | 401, 403                            | AUTH_FAILURE    |
 * | other 4xx                           | INVALID_REQUEST |
 * | anything else                       | UNKNOWN         |
 */
@Slf4j
public final class HttpErrorClassifier {

    private HttpErrorClassifier() {
    }

    public static LlmException classify(String provider, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return new LlmException(ErrorKind.TRANSIENT, provider,
                    provider + " unreachable or timed out: " + e.getMessage(), e);
        }
        if (e instanceof RestClientResponseException re) {
            return classifyStatus(provider, re);
        }
        return new LlmException(ErrorKind.UNKNOWN, provider,
                provider + " call failed: " + e.getMessage(), e);
    }

    public static ErrorKind kindForStatus(int status) {
        if (status == 429) return ErrorKind.RATE_LIMITED;
        if (status == 401 || status == 403) return ErrorKind.AUTH_FAILURE;
        if (status == 408 || status >= 500) return ErrorKind.TRANSIENT;
        if (status >= 400) return ErrorKind.INVALID_REQUEST;
        return ErrorKind.UNKNOWN;
    }

    private static LlmException classifyStatus(String provider, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        ErrorKind kind = kindForStatus(status);
        String body = e.getResponseBodyAsString();
        log.error("{} returned HTTP {} [{}]: {}", provider, status, kind, body);

        Duration retryAfter = kind == ErrorKind.RATE_LIMITED ? parseRetryAfter(e.getResponseHeaders()) : null;
        return new LlmException(kind, provider,
                provider + " error [" + status + "]: " + body, retryAfter, e);
    }

    /** Only the delta-seconds form is honoured; HTTP-date values are ignored. */
    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) return null;
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) return null;
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ex) {
            log.debug("Ignoring non-numeric Retry-After header: {}", value);
            return null;
        }
    }
}
