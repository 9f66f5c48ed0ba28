package com.example.groundedrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Document Q&A with citations plus selective long-term memory.
 * Ingest: file -> section-aware chunks -> embeddings (Ollama) -> pgvector.
 * Ask: pgvector search -> numbered context -> chat completion -> answer + citations.
 * Memory: chat turn -> extracted facts -> USER / COMPANY markdown stores.
 */
@SpringBootApplication
@EnableRetry
public class GroundedRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroundedRagApplication.class, args);
    }
}
