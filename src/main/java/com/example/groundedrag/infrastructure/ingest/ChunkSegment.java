package com.example.groundedrag.infrastructure.ingest;

/**
 * Chunker output before it is bound to a source document.
 */
public record ChunkSegment(String text, int index, String section) {
}
