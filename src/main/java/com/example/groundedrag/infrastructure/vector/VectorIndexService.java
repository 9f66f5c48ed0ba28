package com.example.groundedrag.infrastructure.vector;

import com.example.groundedrag.domain.model.Chunk;
import com.example.groundedrag.infrastructure.config.VectorIndexProperties;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Adapter over the Spring AI vector store. Embedding happens inside the store on both
 * {@link #upsert(List)} and {@link #query(String, int)}.
 */
@Service
public class VectorIndexService {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexService.class);

    public static final String MD_SOURCE = "source";
    public static final String MD_CHUNK_ID = "chunk_id";
    public static final String MD_LOCATOR = "locator";
    public static final String MD_SECTION = "section";

    private final VectorStore vectorStore;
    private final JdbcTemplate jdbcTemplate;
    private final String qualifiedTable;

    public VectorIndexService(
            VectorStore vectorStore,
            JdbcTemplate jdbcTemplate,
            VectorIndexProperties props
    ) {
        this.vectorStore = vectorStore;
        this.jdbcTemplate = jdbcTemplate;
        this.qualifiedTable = props.qualifiedTable();
    }

    /**
     * Ids are derived from {@code source_chunkId}, so re-indexing a document overwrites its earlier rows.
     */
    public int upsert(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return 0;
        }
        List<Document> docs = new ArrayList<>(chunks.size());
        for (Chunk c : chunks) {
            docs.add(new Document(chunkDocumentId(c), c.text(), metadata(c)));
        }

        long t0 = System.nanoTime();
        vectorStore.add(docs);
        log.info("event=vector_upsert chunks={} ms={}", docs.size(), (System.nanoTime() - t0) / 1_000_000);
        return docs.size();
    }

    public List<Document> query(String query, int topK) {
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(topK)
                .build();
        List<Document> docs = vectorStore.similaritySearch(request);
        return docs == null ? List.of() : docs;
    }

    public void drop() {
        jdbcTemplate.execute("TRUNCATE TABLE " + qualifiedTable);
        log.info("event=vector_drop table={}", qualifiedTable);
    }

    static String chunkDocumentId(Chunk chunk) {
        String key = chunk.source() + "_" + chunk.chunkId();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Map<String, Object> metadata(Chunk c) {
        Map<String, Object> md = new HashMap<>();
        md.put(MD_SOURCE, c.source());
        md.put(MD_CHUNK_ID, c.chunkId());
        md.put(MD_LOCATOR, c.locator());
        // store metadata rejects null values
        if (c.section() != null) {
            md.put(MD_SECTION, c.section());
        }
        return md;
    }
}
