package com.example.groundedrag.infrastructure.memory;

import com.example.groundedrag.domain.model.MemoryFact;
import com.example.groundedrag.domain.model.MemoryTarget;
import com.example.groundedrag.domain.model.MemoryWrite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MemoryRepositoryTest {

    @TempDir
    Path tmp;

    private MemoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new MemoryRepository(
                new MemoryFileStore(MemoryTarget.USER, tmp.resolve("USER_MEMORY.md")),
                new MemoryFileStore(MemoryTarget.COMPANY, tmp.resolve("COMPANY_MEMORY.md"))
        );
    }

    @Test
    void writesEachFactToItsOwnStore() {
        List<MemoryWrite> written = repository.appendNew(List.of(
                new MemoryFact(MemoryTarget.USER, "Prefers Mondays", 0.9),
                new MemoryFact(MemoryTarget.COMPANY, "Team X owns Y", 0.95)
        ));

        assertEquals(List.of(
                new MemoryWrite(MemoryTarget.USER, "Prefers Mondays"),
                new MemoryWrite(MemoryTarget.COMPANY, "Team X owns Y")
        ), written);
        assertEquals(List.of("Prefers Mondays"), repository.read(MemoryTarget.USER));
        assertEquals(List.of("Team X owns Y"), repository.read(MemoryTarget.COMPANY));
    }

    @Test
    void existingSummaryBlocksCaseInsensitiveDuplicate() {
        repository.appendNew(List.of(new MemoryFact(MemoryTarget.USER, "Likes Mondays", 0.9)));

        List<MemoryWrite> written = repository.appendNew(List.of(new MemoryFact(MemoryTarget.USER, "likes mondays", 0.9)));

        assertTrue(written.isEmpty());
        assertEquals(List.of("Likes Mondays"), repository.read(MemoryTarget.USER));
    }

    @Test
    void handEditedLineWithExtraSpacesStillBlocksDuplicate() throws Exception {
        Files.writeString(tmp.resolve("USER_MEMORY.md"), "# USER MEMORY\n\n- Likes  Mondays\n");

        List<MemoryWrite> written = repository.appendNew(List.of(new MemoryFact(MemoryTarget.USER, "likes mondays", 0.9)));

        assertTrue(written.isEmpty());
        assertEquals("# USER MEMORY\n\n- Likes  Mondays\n", Files.readString(tmp.resolve("USER_MEMORY.md")));
    }

    @Test
    void duplicatesWithinOneCallAreWrittenOnce() {
        List<MemoryWrite> written = repository.appendNew(List.of(
                new MemoryFact(MemoryTarget.USER, "Uses Excel", 0.9),
                new MemoryFact(MemoryTarget.USER, "USES EXCEL", 0.9)
        ));

        assertEquals(1, written.size());
        assertEquals(List.of("Uses Excel"), repository.read(MemoryTarget.USER));
    }

    @Test
    void sameSummaryMayLiveInBothStores() {
        List<MemoryWrite> written = repository.appendNew(List.of(
                new MemoryFact(MemoryTarget.USER, "Quarterly close is in March", 0.9),
                new MemoryFact(MemoryTarget.COMPANY, "Quarterly close is in March", 0.9)
        ));

        assertEquals(2, written.size());
    }

    @Test
    void concurrentCallersDoNotDuplicateLines() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<MemoryWrite>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<List<MemoryWrite>> task = () -> {
                    start.await();
                    return repository.appendNew(List.of(new MemoryFact(MemoryTarget.COMPANY, "Team X owns Y", 0.9)));
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int total = 0;
            for (Future<List<MemoryWrite>> f : futures) {
                total += f.get(10, TimeUnit.SECONDS).size();
            }
            assertEquals(1, total);
            assertEquals(List.of("Team X owns Y"), repository.read(MemoryTarget.COMPANY));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void storesMustMatchTheirTargets() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryRepository(
                new MemoryFileStore(MemoryTarget.COMPANY, tmp.resolve("a.md")),
                new MemoryFileStore(MemoryTarget.COMPANY, tmp.resolve("b.md"))
        ));
    }
}
