package com.example.groundedrag.application.service;

import com.example.groundedrag.domain.model.Citation;
import com.example.groundedrag.domain.model.RetrievedRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved records for the prompt and derives the citation list shown next to the answer.
 * <p>
 * The context keeps retrieval rank order and numbers blocks from 1, so an inline citation can be traced
 * back to the rank that produced it. Citations are unique per (source, locator), first seen wins.
 */
@Component
public class CitationFormatter {

    /**
     * Inline markup the model is asked to reproduce. Not validated on the way back.
     */
    public static final String CITATION_MARKUP = "[Source: %s, Locator: %s]";

    public record FormattedContext(String context, List<Citation> citations) {
    }

    private record CitationKey(String source, String locator) {
    }

    public FormattedContext format(List<RetrievedRecord> records) {
        if (records == null || records.isEmpty()) {
            return new FormattedContext("", List.of());
        }
        return new FormattedContext(renderContext(records), citations(records));
    }

    public String renderContext(List<RetrievedRecord> records) {
        List<String> blocks = new ArrayList<>(records.size());
        int rank = 1;
        for (RetrievedRecord r : records) {
            blocks.add("[" + rank++ + "] (Source: " + r.source() + ", Locator: " + r.locator() + ")\n" + r.text());
        }
        return String.join("\n\n", blocks);
    }

    public List<Citation> citations(List<RetrievedRecord> records) {
        Map<CitationKey, Citation> seen = new LinkedHashMap<>();
        for (RetrievedRecord r : records) {
            seen.putIfAbsent(new CitationKey(r.source(), r.locator()), new Citation(r.source(), r.locator(), r.snippet()));
        }
        return List.copyOf(seen.values());
    }

    public static String markup(String source, String locator) {
        return String.format(CITATION_MARKUP, source, locator);
    }
}
