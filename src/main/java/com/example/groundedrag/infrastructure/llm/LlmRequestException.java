package com.example.groundedrag.infrastructure.llm;

/**
 * Request rejected by the endpoint or a response that does not look like a chat completion.
 */
public class LlmRequestException extends LlmException {

    public LlmRequestException(String message) {
        super(message);
    }

    public LlmRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
