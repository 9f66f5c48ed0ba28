package com.example.groundedrag.infrastructure.memory;

import com.example.groundedrag.infrastructure.llm.CompletionResult;
import com.example.groundedrag.infrastructure.llm.LlmClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the model which facts of a chat turn are worth keeping. Any failure, including a reply that is not
 * a JSON array, yields no candidates.
 */
@Component
public class MemoryExtractor {

    private static final Logger log = LoggerFactory.getLogger(MemoryExtractor.class);

    private static final String MEMORY_PROMPT = """
            Analyze this conversation turn. Extract ONLY high-signal, reusable facts worth remembering.
            Rules:
            - USER facts: personal preferences, role, workflow preferences (e.g., "User prefers weekly summaries on Mondays", "User is a Project Finance Analyst")
            - COMPANY facts: org-wide learnings, workflows, bottlenecks (e.g., "Asset Management interfaces with Project Finance", "Recurring bottleneck is X")
            - Do NOT store: raw transcript, secrets, PII, low-value chitchat
            - Be selective: only 0-2 facts per turn, high confidence only

            Conversation turn:
            {turn}

            Respond with a JSON array of objects. Each object: {"target": "USER" or "COMPANY", "summary": "brief fact", "confidence": 0.0-1.0}
            If nothing worth storing, return: []
            Example: [{"target": "USER", "summary": "User prefers weekly summaries on Mondays.", "confidence": 0.9}]""";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public MemoryExtractor(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public ExtractionResult extract(String userMessage, String assistantMessage) {
        String turn = "User: " + safe(userMessage) + "\nAssistant: " + safe(assistantMessage);
        CompletionResult completion = llmClient.complete(MEMORY_PROMPT.replace("{turn}", turn));

        switch (completion.status()) {
            case SUCCESS:
                return parse(completion.text());
            case UNAVAILABLE:
                return ExtractionResult.empty(ExtractionResult.Status.UNAVAILABLE);
            default:
                log.warn("event=memory_extract_failed status={} err={}", completion.status(), completion.error());
                return ExtractionResult.empty(ExtractionResult.Status.FAILED);
        }
    }

    ExtractionResult parse(String raw) {
        String content = stripCodeFence(raw == null ? "" : raw.strip());
        if (content.isEmpty()) {
            return ExtractionResult.extracted(List.of());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (Exception e) {
            log.warn("event=memory_extract_malformed body_snip={} err={}", snippet(content), e.getMessage());
            return ExtractionResult.empty(ExtractionResult.Status.MALFORMED_RESPONSE);
        }
        if (root == null || !root.isArray()) {
            log.warn("event=memory_extract_malformed body_snip={} err=not a JSON array", snippet(content));
            return ExtractionResult.empty(ExtractionResult.Status.MALFORMED_RESPONSE);
        }

        List<MemoryCandidate> candidates = new ArrayList<>();
        for (JsonNode item : root) {
            if (!item.isObject()) {
                continue;
            }
            candidates.add(new MemoryCandidate(
                    text(item, "target"),
                    text(item, "summary"),
                    confidence(item.get("confidence"))
            ));
        }
        log.info("event=memory_extract_ok candidates={}", candidates.size());
        return ExtractionResult.extracted(candidates);
    }

    static String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        List<String> lines = content.lines().toList();
        if (lines.size() <= 2) {
            return "[]";
        }
        return String.join("\n", lines.subList(1, lines.size() - 1)).strip();
    }

    private static String text(JsonNode item, String field) {
        JsonNode v = item.get(field);
        return v == null || v.isNull() ? "" : v.asText();
    }

    private static double confidence(JsonNode v) {
        if (v == null || v.isNull()) {
            return 0.0;
        }
        if (v.isNumber()) {
            return v.asDouble();
        }
        // "0.9" as a string is common enough from smaller models
        return v.isTextual() ? v.asDouble(0.0) : 0.0;
    }

    private static String safe(String s) {
        return s == null ? "" : s.trim();
    }

    private static String snippet(String s) {
        String t = s.replaceAll("\\s+", " ").trim();
        return t.length() <= 200 ? t : t.substring(0, 200) + "...";
    }
}
