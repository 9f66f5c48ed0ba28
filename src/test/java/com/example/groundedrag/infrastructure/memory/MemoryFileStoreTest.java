package com.example.groundedrag.infrastructure.memory;

import com.example.groundedrag.domain.model.MemoryTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemoryFileStoreTest {

    @Test
    void missingFileReadsAsEmpty(@TempDir Path tmp) {
        MemoryFileStore store = new MemoryFileStore(MemoryTarget.USER, tmp.resolve("USER_MEMORY.md"));

        assertTrue(store.readSummaries().isEmpty());
        assertTrue(store.readSummaryKeys().isEmpty());
    }

    @Test
    void firstAppendWritesHeader(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("nested/COMPANY_MEMORY.md");
        MemoryFileStore store = new MemoryFileStore(MemoryTarget.COMPANY, file);

        store.append("Asset Management interfaces with Project Finance.");
        store.append("Recurring bottleneck is vendor onboarding.");

        String content = Files.readString(file);
        assertTrue(content.startsWith("# COMPANY MEMORY\n"));
        assertTrue(content.endsWith("- Asset Management interfaces with Project Finance.\n"
                + "- Recurring bottleneck is vendor onboarding.\n"));
        assertEquals(List.of("Asset Management interfaces with Project Finance.", "Recurring bottleneck is vendor onboarding."),
                store.readSummaries());
    }

    @Test
    void handEditedFileIsParsedLeniently(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("USER_MEMORY.md");
        Files.writeString(file, "# USER MEMORY\n\n<!-- notes -->\n\n   -   Likes Mondays   \n\n\t- Works remotely\n-\nplain line\n-    \n");
        MemoryFileStore store = new MemoryFileStore(MemoryTarget.USER, file);

        assertEquals(List.of("Likes Mondays", "Works remotely"), store.readSummaries());
        assertEquals(Set.of("likes mondays", "works remotely"), store.readSummaryKeys());
    }

    @Test
    void keyCollapsesWhitespaceAndCase() {
        assertEquals("likes mondays", MemoryFileStore.key("  Likes \t Mondays "));
        assertEquals("likes mondays", MemoryFileStore.key("Likes\u00A0Mondays"));
        assertEquals("Likes Mondays", MemoryFileStore.normalize(" Likes\n  Mondays"));
    }

    @Test
    void appendAfterFileWithoutTrailingNewlineStartsNewLine(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("USER_MEMORY.md");
        Files.writeString(file, "# USER MEMORY\n- Existing fact");
        MemoryFileStore store = new MemoryFileStore(MemoryTarget.USER, file);

        store.append("New fact");

        assertEquals("# USER MEMORY\n- Existing fact\n- New fact\n", Files.readString(file));
        assertEquals(List.of("Existing fact", "New fact"), store.readSummaries());
    }
}
