package com.exitbot.assistant.resilience;

import com.exitbot.assistant.exception.LlmException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Per-provider breaker backed by a Resilience4j {@link CircuitBreaker}.
 *
 * Circuit breaker config:
 * - COUNT_BASED window of failureThreshold calls, all of which must fail: opens after
 *   failureThreshold consecutive failures
 * - OPEN for coolDown, then the next call is let through as the trial (no automatic transition)
 * - HALF_OPEN admits halfOpenSuccessThreshold trials; any trial failure re-opens
 *   with a fresh cool-down
 * - slow calls never open the circuit, only errors do
 *
 * The consecutive failure count reported by {@link #status()} resets on every success
 * while CLOSED, which the sliding-window metrics alone do not express.
 */
@Slf4j
public class ProviderCircuitBreaker {

    private static final Duration NEVER_SLOW = Duration.ofDays(365);

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant openedAt;

    public ProviderCircuitBreaker(String name,
                                  int failureThreshold,
                                  Duration coolDown,
                                  int halfOpenSuccessThreshold,
                                  Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (halfOpenSuccessThreshold < 1) {
            throw new IllegalArgumentException("halfOpenSuccessThreshold must be >= 1");
        }
        this.name = name;
        this.clock = clock;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .slowCallRateThreshold(100)
                .slowCallDurationThreshold(NEVER_SLOW)
                .waitDurationInOpenState(coolDown)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .permittedNumberOfCallsInHalfOpenState(halfOpenSuccessThreshold)
                .writableStackTraceEnabled(false)
                .build();
        this.circuitBreaker = new CircuitBreakerStateMachine(name, config, clock);

        registerEventListeners(coolDown);
    }

    private void registerEventListeners(Duration coolDown) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> {
                    CircuitBreaker.State to = event.getStateTransition().getToState();
                    if (to == CircuitBreaker.State.OPEN) {
                        openedAt = clock.instant();
                        log.warn("[{}] Circuit breaker state: {} (failures={}, coolDown={})",
                                name, event.getStateTransition(), consecutiveFailures.get(), coolDown);
                    } else {
                        if (to == CircuitBreaker.State.CLOSED) {
                            consecutiveFailures.set(0);
                        }
                        log.info("[{}] Circuit breaker state: {}", name, event.getStateTransition());
                    }
                })
                .onCallNotPermitted(event -> log.debug("[{}] Circuit not permitting calls, rejecting", name));
    }

    public <T> T execute(Supplier<T> call) {
        try {
            circuitBreaker.acquirePermission();
        } catch (CallNotPermittedException e) {
            throw LlmException.circuitOpen(name);
        }
        boolean trial = circuitBreaker.getState() == CircuitBreaker.State.HALF_OPEN;

        long start = System.nanoTime();
        T result;
        try {
            result = call.get();
        } catch (RuntimeException | Error e) {
            onFailure(trial, System.nanoTime() - start, e);
            throw e;
        }
        if (!trial && circuitBreaker.getState() == CircuitBreaker.State.CLOSED) {
            consecutiveFailures.set(0);
        }
        circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        return result;
    }

    private void onFailure(boolean trial, long elapsedNanos, Throwable error) {
        consecutiveFailures.incrementAndGet();
        circuitBreaker.onError(elapsedNanos, TimeUnit.NANOSECONDS, error);
        if (trial) {
            log.warn("[{}] Half-open trial failed: {}", name, error.getMessage());
            // several permitted trials: the first failure re-opens without waiting for the rest
            if (circuitBreaker.getState() == CircuitBreaker.State.HALF_OPEN) {
                circuitBreaker.transitionToOpenState();
            }
        }
    }

    /** Forces CLOSED and clears all counters. */
    public void reset() {
        circuitBreaker.reset();
        consecutiveFailures.set(0);
        openedAt = null;
    }

    public CircuitStatus status() {
        return new CircuitStatus(name, getState(), consecutiveFailures.get(), openedAt);
    }

    public CircuitState getState() {
        switch (circuitBreaker.getState()) {
            case CLOSED:
                return CircuitState.CLOSED;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.OPEN;
        }
    }

    public String getName() {
        return name;
    }
}
