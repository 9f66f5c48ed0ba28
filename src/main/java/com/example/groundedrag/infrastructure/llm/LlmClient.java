package com.example.groundedrag.infrastructure.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The completion capability as seen by the rest of the service: never throws for provider failures,
 * reports them as a {@link CompletionResult} status instead.
 */
@Component
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    private final ChatCompletionGateway gateway;

    public LlmClient(ChatCompletionGateway gateway) {
        this.gateway = gateway;
    }

    public boolean isAvailable() {
        return gateway.isConfigured();
    }

    public CompletionResult complete(String prompt) {
        if (!gateway.isConfigured()) {
            return CompletionResult.unavailable("No LLM configured");
        }
        try {
            return CompletionResult.success(gateway.complete(prompt));
        } catch (LlmUnavailableException e) {
            log.warn("event=llm_unavailable err={}", e.getMessage());
            return CompletionResult.unavailable(e.getMessage());
        } catch (LlmTransientException e) {
            log.warn("event=llm_transient_failure quota={} err={}", e.isQuotaOrRateLimit(), e.getMessage());
            return CompletionResult.transientFailure(e.getMessage());
        } catch (LlmException e) {
            log.warn("event=llm_failed err={}", e.getMessage());
            return CompletionResult.failed(e.getMessage());
        }
    }
}
