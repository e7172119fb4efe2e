package com.exitbot.assistant.resilience;

public enum CircuitState {
    CLOSED, OPEN, HALF_OPEN
}
