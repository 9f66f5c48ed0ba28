package com.example.groundedrag.domain.model;

public record RetrievedRecord(
        String text,
        String source,
        String locator,
        String snippet
) {
}
