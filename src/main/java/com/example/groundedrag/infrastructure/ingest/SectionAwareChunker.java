package com.example.groundedrag.infrastructure.ingest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class SectionAwareChunker {

    // Unicode-aware so that no-break spaces from PDF extraction separate words
    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MAX_SECTION_LABEL = 80;

    private final int chunkSize;
    private final int overlap;

    public SectionAwareChunker(
            @Value("${groundedrag.rag.chunk.size:500}") int chunkSize,
            @Value("${groundedrag.rag.chunk.overlap:50}") int overlap
    ) {
        validate(chunkSize, overlap);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public Stream<ChunkSegment> chunk(String text) {
        return chunk(text, chunkSize, overlap);
    }

    /**
     * Splits text into overlapping, section-tagged segments.
     * Sections are separated by blank lines; a section whose first line starts with '#' or ends with ':'
     * sets the label for every chunk emitted after it. Size is measured in characters (word + one separator),
     * overlap in words. The stream is lazy: sections are tokenized only as chunks are pulled.
     */
    public Stream<ChunkSegment> chunk(String text, int chunkSize, int overlap) {
        validate(chunkSize, overlap);
        if (text == null || text.isBlank()) {
            return Stream.empty();
        }
        Iterator<ChunkSegment> it = new ChunkIterator(BLANK_LINE.split(text.strip()), chunkSize, overlap);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    static boolean isHeading(String line) {
        return line.startsWith("#") || line.endsWith(":");
    }

    static String sectionLabel(String headingLine) {
        String raw = headingLine.strip();
        String label = raw.replaceFirst("^#+", "");
        if (label.endsWith(":")) {
            label = label.substring(0, label.length() - 1);
        }
        label = label.strip();
        if (label.isEmpty()) {
            label = raw;
        }
        return label.length() > MAX_SECTION_LABEL ? label.substring(0, MAX_SECTION_LABEL).strip() : label;
    }

    private static void validate(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must be >= 0");
        }
    }

    /**
     * Single pass over the sections. The current section label, the word buffer and the next index are
     * the only state carried between emissions.
     */
    private static final class ChunkIterator implements Iterator<ChunkSegment> {

        private final String[] sections;
        private final int chunkSize;
        private final int overlap;

        private final Deque<String> pendingWords = new ArrayDeque<>();
        private final List<String> buffer = new ArrayList<>();
        private int bufferLength;
        private int sectionCursor;
        private int nextIndex;
        private String currentSection;
        private boolean finished;
        private ChunkSegment next;

        ChunkIterator(String[] sections, int chunkSize, int overlap) {
            this.sections = sections;
            this.chunkSize = chunkSize;
            this.overlap = overlap;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !finished) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public ChunkSegment next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ChunkSegment out = next;
            next = null;
            return out;
        }

        private ChunkSegment advance() {
            while (true) {
                while (!pendingWords.isEmpty()) {
                    String word = pendingWords.poll();
                    buffer.add(word);
                    bufferLength += word.length() + 1;
                    if (bufferLength >= chunkSize) {
                        ChunkSegment emitted = emit();
                        seedOverlap();
                        return emitted;
                    }
                }
                if (!loadNextSection()) {
                    finished = true;
                    if (buffer.isEmpty()) {
                        return null;
                    }
                    ChunkSegment last = emit();
                    buffer.clear();
                    bufferLength = 0;
                    return last;
                }
            }
        }

        private boolean loadNextSection() {
            while (sectionCursor < sections.length) {
                String section = sections[sectionCursor++].strip();
                if (section.isEmpty()) {
                    continue;
                }
                String firstLine = section.lines().findFirst().orElse("");
                if (isHeading(firstLine)) {
                    currentSection = sectionLabel(firstLine);
                }
                for (String word : WHITESPACE.split(section)) {
                    if (!word.isEmpty()) {
                        pendingWords.add(word);
                    }
                }
                return true;
            }
            return false;
        }

        private ChunkSegment emit() {
            return new ChunkSegment(String.join(" ", buffer), nextIndex++, currentSection);
        }

        private void seedOverlap() {
            if (buffer.size() > overlap) {
                List<String> tail = new ArrayList<>(buffer.subList(buffer.size() - overlap, buffer.size()));
                buffer.clear();
                buffer.addAll(tail);
            }
            bufferLength = 0;
            for (String w : buffer) {
                bufferLength += w.length() + 1;
            }
        }
    }
}
