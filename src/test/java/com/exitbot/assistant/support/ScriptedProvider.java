package com.exitbot.assistant.support;

import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.llm.LlmProvider;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;

import java.time.Duration;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Upstream stand-in: plays queued outcomes in order, then falls back to a default behaviour.
 */
public class ScriptedProvider implements LlmProvider {

    private final String name;
    private final AtomicInteger invocations = new AtomicInteger();
    private final ConcurrentLinkedQueue<Function<LlmRequest, LlmResponse>> script = new ConcurrentLinkedQueue<>();
    private volatile Function<LlmRequest, LlmResponse> fallback = ScriptedProvider::echo;
    private volatile Duration latency = Duration.ZERO;

    public ScriptedProvider(String name) {
        this.name = name;
    }

    public ScriptedProvider thenFail(ErrorKind kind) {
        script.add(r -> { throw error(kind); });
        return this;
    }

    public ScriptedProvider thenThrow(LlmException error) {
        script.add(r -> { throw error; });
        return this;
    }

    public ScriptedProvider thenSucceed() {
        script.add(ScriptedProvider::echo);
        return this;
    }

    public ScriptedProvider alwaysFail(ErrorKind kind) {
        fallback = r -> { throw error(kind); };
        return this;
    }

    public ScriptedProvider alwaysSucceed() {
        fallback = ScriptedProvider::echo;
        return this;
    }

    public ScriptedProvider withLatency(Duration latency) {
        this.latency = latency;
        return this;
    }

    public int invocations() {
        return invocations.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public LlmResponse invoke(LlmRequest request) {
        invocations.incrementAndGet();
        if (!latency.isZero()) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmException(ErrorKind.TRANSIENT, name, "interrupted", e);
            }
        }
        Function<LlmRequest, LlmResponse> next = script.poll();
        return (next != null ? next : fallback).apply(request);
    }

    private LlmException error(ErrorKind kind) {
        return new LlmException(kind, name, "scripted " + kind);
    }

    private static LlmResponse echo(LlmRequest request) {
        String last = request.lastUserMessage() != null ? request.lastUserMessage().getContent() : "";
        return LlmResponse.builder()
                .content("reply to: " + last)
                .provider("scripted")
                .build();
    }
}
