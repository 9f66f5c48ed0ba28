package com.example.groundedrag.infrastructure.llm;

import java.util.Locale;

/**
 * Rate limit, exhausted quota, server-side error or a dropped connection. Retried before it surfaces.
 */
public class LlmTransientException extends LlmException {

    public LlmTransientException(String message) {
        super(message);
    }

    public LlmTransientException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isQuotaOrRateLimit() {
        String msg = getMessage() == null ? "" : getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("429") || msg.contains("quota") || msg.contains("rate limit");
    }
}
