package com.example.groundedrag.infrastructure.ingest;

import com.example.groundedrag.controller.exception.BusinessException;
import com.example.groundedrag.domain.dto.IngestResult;
import com.example.groundedrag.domain.model.Chunk;
import com.example.groundedrag.infrastructure.vector.VectorIndexService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class IngestServiceTest {

    private VectorIndexService vectorIndex;
    private IngestService service;

    @BeforeEach
    void setUp() {
        vectorIndex = mock(VectorIndexService.class);
        when(vectorIndex.upsert(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        service = new IngestService(new DocumentParser(), new SectionAwareChunker(40, 2), vectorIndex, "missing-dir");
    }

    @Test
    void chunksCarrySourceAndLocator(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("guide.md");
        Files.writeString(file, "## Setup\n\nInstall the agent, then configure the collector and restart the service.");

        List<Chunk> chunks = service.ingestFile(file);

        assertTrue(chunks.size() > 1);
        for (int i = 0; i < chunks.size(); i++) {
            assertEquals("guide.md", chunks.get(i).source());
            assertEquals(i, chunks.get(i).chunkId());
            assertEquals("Setup (chunk " + i + ")", chunks.get(i).locator());
        }
    }

    @Test
    void singleUnsupportedDocumentIsReportedToCaller(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("slides.pptx");
        Files.writeString(file, "binary-ish");

        assertThrows(UnsupportedDocumentException.class, () -> service.ingestFile(file));
        verifyNoInteractions(vectorIndex);
    }

    @Test
    void uploadBatchContinuesPastUnsupportedFiles() {
        List<MultipartFile> files = List.of(
                new MockMultipartFile("files", "a.txt", "text/plain", "alpha beta gamma".getBytes(StandardCharsets.UTF_8)),
                new MockMultipartFile("files", "b.exe", "application/octet-stream", new byte[]{1, 2, 3}),
                new MockMultipartFile("files", "c.md", "text/markdown", "delta epsilon".getBytes(StandardCharsets.UTF_8))
        );

        IngestResult result = service.ingestUploads(files, true);

        assertEquals(List.of("a.txt", "c.md"), result.documents());
        assertEquals(List.of("b.exe"), result.rejected());
        assertEquals(2, result.chunks());
        verify(vectorIndex).drop();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Chunk>> captor = ArgumentCaptor.forClass(List.class);
        verify(vectorIndex).upsert(captor.capture());
        assertEquals(List.of("a.txt", "c.md"), captor.getValue().stream().map(Chunk::source).toList());
    }

    @Test
    void resetIsSkippedWhenNothingWasParsed() {
        List<MultipartFile> files = List.of(
                new MockMultipartFile("files", "b.exe", "application/octet-stream", new byte[]{1})
        );

        IngestResult result = service.ingestUploads(files, true);

        assertEquals(0, result.chunks());
        verify(vectorIndex, never()).drop();
    }

    @Test
    void directoryIngestReadsSupportedFilesInNameOrder(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("b.txt"), "second document");
        Files.writeString(tmp.resolve("a.md"), "first document");
        Files.writeString(tmp.resolve("ignored.csv"), "x,y");

        IngestResult result = service.ingestDirectory(tmp, false);

        assertEquals(List.of("a.md", "b.txt"), result.documents());
        assertTrue(result.rejected().isEmpty());
        verify(vectorIndex, never()).drop();
    }

    @Test
    void missingSampleDirectoryIsNotFound() {
        BusinessException ex = assertThrows(BusinessException.class, () -> service.ingestSamples(true));
        assertEquals(404, ex.getStatus().value());
    }
}
