package com.example.groundedrag.infrastructure.llm;

/**
 * No endpoint or credentials configured, endpoint unreachable, or the call timed out.
 */
public class LlmUnavailableException extends LlmException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
