package com.example.groundedrag.infrastructure.memory;

import com.example.groundedrag.domain.model.MemoryFact;
import com.example.groundedrag.domain.model.MemoryTarget;
import com.example.groundedrag.domain.model.MemoryWrite;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Both memory stores behind one read-dedup-append critical section.
 * Store locks are always taken in {@link MemoryTarget} order, so concurrent callers cannot deadlock and
 * cannot both decide that the same summary is new.
 */
public class MemoryRepository {

    private static final Logger log = LoggerFactory.getLogger(MemoryRepository.class);

    private final Map<MemoryTarget, MemoryFileStore> stores = new EnumMap<>(MemoryTarget.class);

    public MemoryRepository(MemoryFileStore userStore, MemoryFileStore companyStore) {
        register(userStore, MemoryTarget.USER);
        register(companyStore, MemoryTarget.COMPANY);
    }

    public MemoryFileStore store(MemoryTarget target) {
        return stores.get(target);
    }

    public List<String> read(MemoryTarget target) {
        MemoryFileStore store = stores.get(target);
        store.lock().lock();
        try {
            return store.readSummaries();
        } finally {
            store.lock().unlock();
        }
    }

    /**
     * Appends the facts whose summary is not yet stored for their target, in the given order, and returns
     * exactly those. Repeats within {@code facts} are written once.
     */
    public List<MemoryWrite> appendNew(List<MemoryFact> facts) {
        if (facts.isEmpty()) {
            return List.of();
        }
        List<MemoryFileStore> ordered = new ArrayList<>(stores.values());
        ordered.forEach(s -> s.lock().lock());
        try {
            Map<MemoryTarget, Set<String>> existing = new EnumMap<>(MemoryTarget.class);
            for (MemoryFileStore s : ordered) {
                existing.put(s.target(), s.readSummaryKeys());
            }

            List<MemoryWrite> written = new ArrayList<>();
            for (MemoryFact fact : facts) {
                Set<String> keys = existing.get(fact.target());
                if (!keys.add(MemoryFileStore.key(fact.summary()))) {
                    log.debug("event=memory_duplicate target={} summary={}", fact.target(), fact.summary());
                    continue;
                }
                stores.get(fact.target()).append(fact.summary());
                written.add(new MemoryWrite(fact.target(), fact.summary()));
            }
            return written;
        } finally {
            for (int i = ordered.size() - 1; i >= 0; i--) {
                ordered.get(i).lock().unlock();
            }
        }
    }

    private void register(MemoryFileStore store, MemoryTarget expected) {
        if (store.target() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " store but got " + store.target());
        }
        stores.put(expected, store);
    }
}
