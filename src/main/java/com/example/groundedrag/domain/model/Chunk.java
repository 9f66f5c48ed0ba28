package com.example.groundedrag.domain.model;

public record Chunk(
        String text,
        String source,
        int chunkId,
        String section
) {

    /**
     * Human-readable pointer back into the source, e.g. {@code "Pricing (chunk 3)"}.
     */
    public String locator() {
        String base = "chunk " + chunkId;
        if (section == null || section.isBlank()) {
            return base;
        }
        return section + " (" + base + ")";
    }
}
