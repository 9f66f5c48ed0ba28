package com.example.groundedrag.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Chunk index on pgvector. Replaces the auto-configured store so that table, schema and batch size come
 * from {@link VectorIndexProperties}; embeddings are computed by the Ollama model on add and search.
 */
@Configuration
@EnableConfigurationProperties(VectorIndexProperties.class)
public class PgVectorConfig {

    private static final Logger log = LoggerFactory.getLogger(PgVectorConfig.class);

    @Bean
    public PgVectorStore chunkVectorStore(
            JdbcTemplate jdbcTemplate,
            EmbeddingModel embeddingModel,
            VectorIndexProperties props
    ) {
        log.info("event=chunk_index_config table={} dimensions={} initSchema={} maxBatch={}",
                props.qualifiedTable(), props.dimensions(), props.initializeSchema(), props.maxBatchSize());

        return PgVectorStore.builder(jdbcTemplate, embeddingModel)
                .schemaName(props.schema())
                .vectorTableName(props.table())
                .dimensions(props.dimensions())
                .initializeSchema(props.initializeSchema())
                .maxDocumentBatchSize(props.maxBatchSize())
                .indexType(PgVectorStore.PgIndexType.HNSW)
                .distanceType(PgVectorStore.PgDistanceType.COSINE_DISTANCE)
                .build();
    }
}
