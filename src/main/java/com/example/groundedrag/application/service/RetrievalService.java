package com.example.groundedrag.application.service;

import com.example.groundedrag.domain.model.RetrievedRecord;
import com.example.groundedrag.infrastructure.vector.VectorIndexService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Vector search normalized into citation-bearing records. A missing index or an empty result is an
 * empty list, never an error.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    static final String UNKNOWN = "unknown";
    static final String TRUNCATION_MARKER = "...";

    private final VectorIndexService vectorIndex;
    private final int defaultTopK;
    private final int maxTopK;
    private final int snippetChars;

    public RetrievalService(
            VectorIndexService vectorIndex,
            @Value("${groundedrag.rag.retrieve.default-top-k:5}") int defaultTopK,
            @Value("${groundedrag.rag.retrieve.max-top-k:10}") int maxTopK,
            @Value("${groundedrag.rag.retrieve.snippet-chars:200}") int snippetChars
    ) {
        this.vectorIndex = vectorIndex;
        this.maxTopK = Math.max(1, maxTopK);
        this.defaultTopK = Math.min(Math.max(1, defaultTopK), this.maxTopK);
        this.snippetChars = Math.max(1, snippetChars);
    }

    public List<RetrievedRecord> retrieve(String query, int topK) {
        int k = topK <= 0 ? defaultTopK : Math.min(topK, maxTopK);

        long t0 = System.nanoTime();
        List<Document> hits;
        try {
            hits = vectorIndex.query(query, k);
        } catch (RuntimeException e) {
            // usually the table has not been created yet
            log.warn("event=retrieve_unavailable topK={} err={}", k, e.toString());
            return List.of();
        }

        List<RetrievedRecord> out = new ArrayList<>(hits.size());
        for (Document d : hits) {
            String text = d.getText() == null ? "" : d.getText();
            Map<String, Object> md = d.getMetadata();
            out.add(new RetrievedRecord(
                    text,
                    metadataString(md, VectorIndexService.MD_SOURCE),
                    metadataString(md, VectorIndexService.MD_LOCATOR),
                    snippet(text)
            ));
        }

        log.info("event=retrieve_done requestedTopK={} topK={} returned={} ms={}",
                topK, k, out.size(), (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    String snippet(String text) {
        if (text.length() <= snippetChars) {
            return text;
        }
        return text.substring(0, snippetChars) + TRUNCATION_MARKER;
    }

    private static String metadataString(Map<String, Object> metadata, String key) {
        if (metadata == null) {
            return UNKNOWN;
        }
        Object v = metadata.get(key);
        return v == null ? UNKNOWN : String.valueOf(v);
    }
}
