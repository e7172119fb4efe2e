package com.exitbot.assistant.resilience;

import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.llm.LlmProvider;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorator that re-attempts TRANSIENT and RATE_LIMITED failures with exponential backoff.
 *
 * Retry config (llm.retry in application.yml):
 * - maxRetries retries after the first attempt
 * - delay before retry n = baseDelay * 2^(n-1), capped at maxDelay: 1s, 2s, 4s ...
 * - optional jitter spreads each delay by ±jitterFactor
 * - RATE_LIMITED waits at least the provider's Retry-After, never longer than maxDelay;
 *   a Retry-After beyond maxDelay is surfaced at once instead of retried
 *
 * AUTH_FAILURE, INVALID_REQUEST and UNKNOWN go straight through after one attempt.
 */
@Slf4j
public class RetryingLlmProvider implements LlmProvider {

    private static final double MULTIPLIER = 2.0;

    private final LlmProvider delegate;
    private final Retry retry;
    private final IntervalFunction backoff;
    private final int maxAttempts;
    private final long maxDelayMillis;

    public RetryingLlmProvider(LlmProvider delegate, LlmProperties.Retry settings) {
        this.delegate = delegate;
        this.maxAttempts = Math.max(0, settings.getMaxRetries()) + 1;
        this.backoff = backoffFunction(settings);
        this.maxDelayMillis = Math.max(1, settings.getMaxDelay().toMillis());

        RetryConfig config = RetryConfig.<LlmResponse>custom()
                .maxAttempts(maxAttempts)
                .intervalBiFunction((attempt, outcome) -> delayMillis(attempt, outcome))
                .retryOnException(this::shouldRetry)
                .build();
        this.retry = Retry.of(delegate.getName(), config);

        registerEventListeners();
    }

    private static IntervalFunction backoffFunction(LlmProperties.Retry settings) {
        long base = Math.max(1, settings.getBaseDelay().toMillis());
        long max  = Math.max(base, settings.getMaxDelay().toMillis());
        double jitter = settings.getJitterFactor();
        if (jitter > 0) {
            return IntervalFunction.ofExponentialRandomBackoff(base, MULTIPLIER, Math.min(jitter, 0.99), max);
        }
        return IntervalFunction.ofExponentialBackoff(base, MULTIPLIER, max);
    }

    private void registerEventListeners() {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("[{}] Retry attempt {}/{} in {}ms after {}",
                        getName(),
                        event.getNumberOfRetryAttempts(),
                        maxAttempts - 1,
                        event.getWaitInterval().toMillis(),
                        describe(event.getLastThrowable())))
                .onError(event -> log.error("[{}] Giving up after {} attempts: {}",
                        getName(),
                        event.getNumberOfRetryAttempts(),
                        describe(event.getLastThrowable())))
                .onIgnoredError(event -> log.debug("[{}] Not retrying: {}",
                        getName(), describe(event.getLastThrowable())));
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public LlmResponse invoke(LlmRequest request) {
        return retry.executeSupplier(() -> delegate.invoke(request));
    }

    Retry getRetry() {
        return retry;
    }

    /**
     * Delay before retry number {@code attempt} (1-based). Package-visible so the schedule
     * can be checked without sleeping.
     */
    long delayMillis(int attempt, Either<Throwable, LlmResponse> outcome) {
        long delay = backoff.apply(attempt);
        if (outcome != null && outcome.isLeft()
                && outcome.getLeft() instanceof LlmException e
                && e.getKind() == ErrorKind.RATE_LIMITED
                && e.getRetryAfter() != null) {
            delay = Math.max(delay, e.getRetryAfter().toMillis());
        }
        return Math.min(delay, maxDelayMillis);
    }

    private boolean shouldRetry(Throwable t) {
        if (!(t instanceof LlmException e) || !e.isRetryable()) {
            return false;
        }
        if (e.getRetryAfter() != null && e.getRetryAfter().toMillis() > maxDelayMillis) {
            log.warn("[{}] Retry-After {} exceeds max delay {}ms, not retrying",
                    getName(), e.getRetryAfter(), maxDelayMillis);
            return false;
        }
        return true;
    }

    private static String describe(Throwable t) {
        if (t instanceof LlmException e) {
            return e.getKind() + ": " + e.getMessage();
        }
        return t == null ? "unknown" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
