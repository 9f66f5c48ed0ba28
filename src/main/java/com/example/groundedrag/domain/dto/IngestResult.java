package com.example.groundedrag.domain.dto;

import java.util.List;

/**
 * Outcome of a batch ingest. {@code rejected} lists documents that could not be parsed; the rest of the batch
 * is still indexed.
 */
public record IngestResult(
        List<String> documents,
        int chunks,
        List<String> rejected
) {
}
