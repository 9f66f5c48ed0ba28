package com.example.groundedrag.domain.model;

public record Citation(
        String source,
        String locator,
        String snippet
) {
}
