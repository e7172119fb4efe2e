package com.exitbot.assistant.exception;

/**
 * Caller asked for a provider name outside groq, openai, ollama and mock.
 */
public class UnknownProviderException extends IllegalArgumentException {

    public UnknownProviderException(String message) {
        super(message);
    }
}
