package com.example.groundedrag.infrastructure.ingest;

import com.example.groundedrag.controller.exception.BusinessException;
import com.example.groundedrag.domain.dto.IngestResult;
import com.example.groundedrag.domain.model.Chunk;
import com.example.groundedrag.infrastructure.vector.VectorIndexService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

@Service
public class IngestService {

    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final DocumentParser parser;
    private final SectionAwareChunker chunker;
    private final VectorIndexService vectorIndex;
    private final Path sampleDir;

    public IngestService(
            DocumentParser parser,
            SectionAwareChunker chunker,
            VectorIndexService vectorIndex,
            @Value("${groundedrag.ingest.sample-dir:sample_docs}") String sampleDir
    ) {
        this.parser = parser;
        this.chunker = chunker;
        this.vectorIndex = vectorIndex;
        this.sampleDir = Path.of(sampleDir);
    }

    /**
     * Parse and chunk a single document. Unsupported types are reported to the caller.
     */
    public List<Chunk> ingestFile(Path file) throws IOException {
        String source = file.getFileName().toString();
        return toChunks(source, parser.parse(file));
    }

    /**
     * Upload pipeline: each file -> text -> chunks; unreadable or unsupported files are listed in the
     * result and skipped, the rest of the batch is indexed.
     */
    public IngestResult ingestUploads(List<MultipartFile> files, boolean reset) {
        List<Chunk> all = new ArrayList<>();
        List<String> documents = new ArrayList<>();
        List<String> rejected = new ArrayList<>();

        for (MultipartFile file : files) {
            String source = file.getOriginalFilename() == null ? "upload" : Path.of(file.getOriginalFilename()).getFileName().toString();
            try (InputStream is = file.getInputStream()) {
                all.addAll(toChunks(source, parser.parse(source, is)));
                documents.add(source);
            } catch (UnsupportedDocumentException e) {
                log.warn("event=ingest_rejected source={} reason={}", source, e.getMessage());
                rejected.add(source);
            } catch (IOException e) {
                log.warn("event=ingest_read_failed source={} err={}", source, e.toString());
                rejected.add(source);
            }
        }

        return index(all, documents, rejected, reset);
    }

    public IngestResult ingestSamples(boolean reset) {
        return ingestDirectory(sampleDir, reset);
    }

    /**
     * Every supported file of the directory, in file-name order. Other files are skipped.
     */
    public IngestResult ingestDirectory(Path dir, boolean reset) {
        if (!Files.isDirectory(dir)) {
            throw new BusinessException(HttpStatus.NOT_FOUND, "Document directory not found: " + dir);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> DocumentParser.isSupported(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }

        List<Chunk> all = new ArrayList<>();
        List<String> documents = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (Path file : files) {
            String source = file.getFileName().toString();
            try {
                all.addAll(ingestFile(file));
                documents.add(source);
            } catch (IOException e) {
                log.warn("event=ingest_read_failed source={} err={}", source, e.toString());
                rejected.add(source);
            }
        }

        return index(all, documents, rejected, reset);
    }

    List<Chunk> toChunks(String source, String text) {
        return chunker.chunk(text)
                .map(seg -> new Chunk(seg.text(), source, seg.index(), seg.section()))
                .collect(Collectors.toList());
    }

    private IngestResult index(List<Chunk> chunks, List<String> documents, List<String> rejected, boolean reset) {
        long t0 = System.nanoTime();
        if (reset && !chunks.isEmpty()) {
            vectorIndex.drop();
        }
        int indexed = vectorIndex.upsert(chunks);

        log.info("event=ingest_complete documents={} chunks={} rejected={} reset={} ms={}",
                documents.size(), indexed, rejected.size(), reset, (System.nanoTime() - t0) / 1_000_000);
        return new IngestResult(documents, indexed, rejected);
    }
}
