package com.example.signalrag.infrastructure.llm;

/**
 * Raised when answer generation is requested without an LLM API key. Never retried.
 */
public class LlmNotConfiguredException extends IllegalStateException {

    public LlmNotConfiguredException(String message) {
        super(message);
    }
}
