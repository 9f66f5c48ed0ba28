package com.example.groundedrag.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum MemoryTarget {
    USER("USER MEMORY", "Append only high-signal, user-specific facts worth remembering."),
    COMPANY("COMPANY MEMORY", "Append reusable org-wide learnings that could help colleagues too.");

    private final String title;
    private final String guidance;

    MemoryTarget(String title, String guidance) {
        this.title = title;
        this.guidance = guidance;
    }

    /**
     * Header written when a store document is created.
     */
    public String header() {
        return "# " + title + "\n\n"
                + "<!--\n"
                + guidance + "\n"
                + "Do NOT dump raw conversation.\n"
                + "Avoid secrets or sensitive information.\n"
                + "-->\n";
    }

    public static Optional<MemoryTarget> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MemoryTarget t : values()) {
            if (t.name().equals(normalized)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
