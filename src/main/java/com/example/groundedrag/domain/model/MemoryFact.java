package com.example.groundedrag.domain.model;

/**
 * Candidate statement extracted from a chat turn. Confidence is only used for filtering and is never persisted.
 */
public record MemoryFact(
        MemoryTarget target,
        String summary,
        double confidence
) {
}
