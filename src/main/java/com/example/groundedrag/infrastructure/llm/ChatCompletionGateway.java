package com.example.groundedrag.infrastructure.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Blocking client for an OpenAI-compatible {@code /v1/chat/completions} endpoint: OpenAI itself or a
 * local Ollama. Failures are thrown as {@link LlmUnavailableException}, {@link LlmTransientException}
 * (retried) or {@link LlmRequestException}.
 */
@Service
public class ChatCompletionGateway {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionGateway.class);

    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_OLLAMA = "ollama";

    private static final String OPENAI_BASE_URL = "https://api.openai.com";
    private static final String OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String OPENAI_MODEL = "gpt-4o-mini";
    private static final String OLLAMA_MODEL = "llama3.2";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    private final String provider;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration readTimeout;

    public ChatCompletionGateway(
            ObjectMapper objectMapper,
            @Value("${groundedrag.llm.provider:openai}") String provider,
            @Value("${groundedrag.llm.base-url:}") String baseUrl,
            @Value("${groundedrag.llm.api-key:}") String apiKey,
            @Value("${groundedrag.llm.model:}") String model,
            @Value("${groundedrag.llm.temperature:0.0}") double temperature,
            @Value("${groundedrag.llm.max-tokens:1024}") int maxTokens,
            @Value("${groundedrag.llm.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${groundedrag.llm.read-timeout-ms:30000}") int readTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.provider = provider == null || provider.isBlank() ? PROVIDER_OPENAI : provider.trim().toLowerCase(Locale.ROOT);
        boolean ollama = PROVIDER_OLLAMA.equals(this.provider);
        this.baseUrl = isBlank(baseUrl) ? (ollama ? OLLAMA_BASE_URL : OPENAI_BASE_URL) : baseUrl.trim();
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = isBlank(model) ? (ollama ? OLLAMA_MODEL : OPENAI_MODEL) : model.trim();
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.readTimeout = Duration.ofMillis(readTimeoutMs);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("event=llm_client_config provider={} baseUrl={} model={} temp={} maxTokens={} configured={} connectTimeoutMs={} readTimeoutMs={}",
                this.provider, this.baseUrl, this.model, temperature, maxTokens, isConfigured(), connectTimeoutMs, readTimeoutMs);
    }

    /**
     * Ollama needs no key; OpenAI is only usable with one.
     */
    public boolean isConfigured() {
        return PROVIDER_OLLAMA.equals(provider) || !apiKey.isBlank();
    }

    @Retryable(
            retryFor = {LlmTransientException.class},
            maxAttemptsExpression = "#{${groundedrag.llm.retries:2} + 1}",
            backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public String complete(String prompt) {
        if (!isConfigured()) {
            throw new LlmUnavailableException("No LLM configured: set groundedrag.llm.provider=ollama or an OpenAI API key");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            throw new LlmRequestException("Failed to serialize chat completion request", e);
        }

        URI uri = URI.create(baseUrl.endsWith("/") ? baseUrl + "v1/chat/completions" : baseUrl + "/v1/chat/completions");
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(readTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        long t0 = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmUnavailableException("LLM request timed out after " + readTimeout.toMillis() + " ms", e);
        } catch (ConnectException e) {
            throw new LlmUnavailableException("LLM endpoint unreachable: " + uri, e);
        } catch (IOException e) {
            throw new LlmTransientException("LLM request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("LLM request interrupted", e);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("event=llm_http_error status={} ms={} body_snip={}", status, ms, snippet(resp.body()));
            String detail = "LLM HTTP error " + status + ": " + snippet(resp.body());
            if (status == 429 || status >= 500 || containsQuota(resp.body())) {
                throw new LlmTransientException(detail);
            }
            throw new LlmRequestException(detail);
        }

        String answer = extractContent(resp.body());
        log.info("event=llm_ok ms={} chars_out={}", ms, answer.length());
        return answer;
    }

    String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (Exception e) {
            throw new LlmRequestException("LLM response is not JSON", e);
        }
        JsonNode choices = root == null ? null : root.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new LlmRequestException("LLM response missing choices");
        }
        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.isObject()) {
            throw new LlmRequestException("LLM response missing message");
        }
        JsonNode content = message.get("content");
        return content == null || content.isNull() ? "" : content.asText().trim();
    }

    private static boolean containsQuota(String body) {
        return body != null && body.toLowerCase(Locale.ROOT).contains("insufficient_quota");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String snippet(String s) {
        if (s == null) return "";
        String t = s.replaceAll("\\s+", " ").trim();
        return t.length() <= 200 ? t : t.substring(0, 200) + "...";
    }
}
