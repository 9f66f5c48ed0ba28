package com.example.groundedrag.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location and shape of the chunk table, bound from {@code groundedrag.pgvector.*}.
 * Dimensions must match the embedding model (all-minilm: 384).
 */
@ConfigurationProperties(prefix = "groundedrag.pgvector")
public record VectorIndexProperties(
        String schema,
        String table,
        int dimensions,
        boolean initializeSchema,
        int maxBatchSize
) {

    public VectorIndexProperties {
        if (schema == null || schema.isBlank()) {
            schema = "public";
        }
        if (table == null || table.isBlank()) {
            table = "rag_chunks";
        }
        if (dimensions <= 0) {
            throw new IllegalArgumentException("groundedrag.pgvector.dimensions must be > 0");
        }
        if (maxBatchSize <= 0) {
            maxBatchSize = 512;
        }
    }

    public String qualifiedTable() {
        return schema + "." + table;
    }
}
