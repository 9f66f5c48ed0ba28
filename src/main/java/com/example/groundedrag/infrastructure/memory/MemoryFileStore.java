package com.example.groundedrag.infrastructure.memory;

import com.example.groundedrag.domain.model.MemoryTarget;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only markdown document holding the facts of one memory target, one {@code - summary} line per fact.
 * <p>
 * Operators may edit the file by hand: headers, comments, blank lines and surrounding whitespace are ignored
 * when reading, only dash-prefixed lines count as facts. The header is written when the file is created.
 */
public class MemoryFileStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryFileStore.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final MemoryTarget target;
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public MemoryFileStore(MemoryTarget target, Path file) {
        this.target = target;
        this.file = file;
    }

    public MemoryTarget target() {
        return target;
    }

    public Path file() {
        return file;
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * Summaries in file order, as written.
     */
    public List<String> readSummaries() {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to read " + target + " memory at " + file, e);
        }
        List<String> out = new ArrayList<>();
        for (String line : lines) {
            String s = line.strip();
            if (!s.startsWith("-")) {
                continue;
            }
            String summary = s.substring(1).strip();
            if (!summary.isEmpty()) {
                out.add(summary);
            }
        }
        return out;
    }

    /**
     * Case-insensitive keys of the stored summaries.
     */
    public Set<String> readSummaryKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (String summary : readSummaries()) {
            keys.add(key(summary));
        }
        return keys;
    }

    public void append(String summary) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            StringBuilder sb = new StringBuilder();
            if (!Files.exists(file)) {
                sb.append(target.header());
            } else if (!endsWithNewline()) {
                sb.append('\n');
            }
            sb.append("- ").append(summary).append('\n');
            Files.writeString(file, sb, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to append to " + target + " memory at " + file, e);
        }
        log.debug("event=memory_append target={} file={}", target, file);
    }

    /**
     * Single-spaced, trimmed form of a summary. Used for writing and, lowercased, for dedup, so a hand-edited
     * line with extra spaces still matches the same fact.
     */
    public static String normalize(String summary) {
        return summary == null ? "" : WHITESPACE.matcher(summary).replaceAll(" ").strip();
    }

    public static String key(String summary) {
        return normalize(summary).toLowerCase(Locale.ROOT);
    }

    private boolean endsWithNewline() throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long len = raf.length();
            if (len == 0) {
                return true;
            }
            raf.seek(len - 1);
            return raf.read() == '\n';
        }
    }
}
