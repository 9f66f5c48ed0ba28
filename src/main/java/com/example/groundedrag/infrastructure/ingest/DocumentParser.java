package com.example.groundedrag.infrastructure.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * Turns an uploaded or on-disk document into raw text for the chunker.
 * Plain text and markdown are decoded as UTF-8; PDFs are extracted page by page so that each page
 * boundary becomes a blank line.
 */
@Component
public class DocumentParser {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".md", ".pdf");

    public static boolean isSupported(String fileName) {
        return SUPPORTED_EXTENSIONS.contains(extension(fileName));
    }

    public String parse(Path file) throws IOException {
        String name = file.getFileName().toString();
        if (!isSupported(name)) {
            throw new UnsupportedDocumentException(name);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return parse(name, is);
        }
    }

    public String parse(String fileName, InputStream content) throws IOException {
        String ext = extension(fileName);
        switch (ext) {
            case ".txt":
            case ".md":
                return new String(content.readAllBytes(), StandardCharsets.UTF_8);
            case ".pdf":
                return extractPdf(content);
            default:
                throw new UnsupportedDocumentException(fileName);
        }
    }

    private static String extractPdf(InputStream pdfStream) throws IOException {
        try (PDDocument document = PDDocument.load(pdfStream)) {
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(document.getNumberOfPages());
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document);
                pages.add(text == null ? "" : text.replace("\u0000", ""));
            }
            return String.join("\n\n", pages);
        }
    }

    private static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
