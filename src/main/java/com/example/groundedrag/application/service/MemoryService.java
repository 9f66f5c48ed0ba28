package com.example.groundedrag.application.service;

import com.example.groundedrag.domain.model.MemoryFact;
import com.example.groundedrag.domain.model.MemoryTarget;
import com.example.groundedrag.domain.model.MemoryWrite;
import com.example.groundedrag.infrastructure.memory.ExtractionResult;
import com.example.groundedrag.infrastructure.memory.MemoryCandidate;
import com.example.groundedrag.infrastructure.memory.MemoryExtractor;
import com.example.groundedrag.infrastructure.memory.MemoryFileStore;
import com.example.groundedrag.infrastructure.memory.MemoryRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    private final MemoryExtractor extractor;
    private final MemoryRepository repository;
    private final double minConfidence;

    public MemoryService(
            MemoryExtractor extractor,
            MemoryRepository repository,
            @Value("${groundedrag.memory.min-confidence:0.8}") double minConfidence
    ) {
        this.extractor = extractor;
        this.repository = repository;
        this.minConfidence = minConfidence;
    }

    /**
     * Pipeline:
     * chat turn -> extracted candidates -> confidence / target filter -> dedup against stores -> append.
     *
     * @return the facts written by this call, in candidate order
     */
    public List<MemoryWrite> processMemory(String userMessage, String assistantMessage) {
        ExtractionResult extraction = extractor.extract(userMessage, assistantMessage);
        if (extraction.candidates().isEmpty()) {
            log.info("event=memory_process_done status={} candidates=0 written=0", extraction.status());
            return List.of();
        }

        List<MemoryFact> accepted = accept(extraction.candidates());
        List<MemoryWrite> written = repository.appendNew(accepted);

        log.info("event=memory_process_done status={} candidates={} accepted={} written={}",
                extraction.status(), extraction.candidates().size(), accepted.size(), written.size());
        return written;
    }

    public List<String> read(MemoryTarget target) {
        return repository.read(target);
    }

    List<MemoryFact> accept(List<MemoryCandidate> candidates) {
        List<MemoryFact> out = new ArrayList<>();
        for (MemoryCandidate c : candidates) {
            Optional<MemoryTarget> target = MemoryTarget.parse(c.target());
            String summary = MemoryFileStore.normalize(c.summary());
            if (target.isEmpty() || summary.isEmpty() || c.confidence() < minConfidence) {
                log.debug("event=memory_candidate_rejected target={} confidence={}", c.target(), c.confidence());
                continue;
            }
            out.add(new MemoryFact(target.get(), summary, c.confidence()));
        }
        return out;
    }
}
