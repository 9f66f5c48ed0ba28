package com.example.groundedrag.infrastructure.memory;

/**
 * One element of the extraction response, unvalidated.
 */
public record MemoryCandidate(String target, String summary, double confidence) {
}
