package com.example.groundedrag.infrastructure.memory;

import java.util.List;

public record ExtractionResult(Status status, List<MemoryCandidate> candidates) {

    public enum Status {
        EXTRACTED,
        UNAVAILABLE,
        FAILED,
        MALFORMED_RESPONSE
    }

    public static ExtractionResult extracted(List<MemoryCandidate> candidates) {
        return new ExtractionResult(Status.EXTRACTED, List.copyOf(candidates));
    }

    public static ExtractionResult empty(Status status) {
        return new ExtractionResult(status, List.of());
    }
}
