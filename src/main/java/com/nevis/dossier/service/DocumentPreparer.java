package com.nevis.dossier.service;

import com.nevis.dossier.model.DocumentDownload;
import com.nevis.dossier.model.PreparedDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

@Service
@Slf4j
public class DocumentPreparer {

    static final String PDF = "application/pdf";
    static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> MIME_BY_EXTENSION = Map.of(
        "pdf", PDF,
        "txt", "text/plain",
        "md", "text/plain",
        "csv", "text/csv",
        "png", "image/png",
        "jpg", "image/jpeg",
        "jpeg", "image/jpeg",
        "webp", "image/webp",
        "gif", "image/gif",
        "heic", "image/heic"
    );

    private final int minTextLength;

    public DocumentPreparer(@Value("${app.preparation.min-text-length:500}") int minTextLength) {
        this.minTextLength = minTextLength;
    }

    public PreparedDocument prepare(DocumentDownload download) {
        byte[] content = download.content();
        String mimeType = detectMimeType(content, download.filename());

        if (PDF.equals(mimeType)) {
            return preparePdf(download, content);
        }

        if (mimeType.startsWith("text/")) {
            String text = new String(content, StandardCharsets.UTF_8);
            return new PreparedDocument(download.documentId(), download.filename(), mimeType, content,
                text, 1, isExtractable(text));
        }

        log.debug("Doc {}: {} has no extractable text, sending raw bytes", download.documentId(), mimeType);
        return new PreparedDocument(download.documentId(), download.filename(), mimeType, content, null, 1, false);
    }

    private PreparedDocument preparePdf(DocumentDownload download, byte[] content) {
        try (PDDocument pdf = loadPdf(content)) {
            int pageCount = pdf.getNumberOfPages();
            String text = new PDFTextStripper().getText(pdf);
            boolean extractable = isExtractable(text);
            log.info("Doc {}: PDF with {} pages, text extractable: {}", download.documentId(), pageCount, extractable);
            return new PreparedDocument(download.documentId(), download.filename(), PDF, content,
                text.isBlank() ? null : text, pageCount, extractable);
        } catch (IOException | RuntimeException e) {
            // PDFBox also fails with unchecked exceptions on some malformed files
            log.warn("Doc {}: PDF could not be parsed, continuing with raw bytes: {}",
                download.documentId(), e.toString());
            return new PreparedDocument(download.documentId(), download.filename(), PDF, content, null, 0, false);
        }
    }

    PDDocument loadPdf(byte[] content) throws IOException {
        return PDDocument.load(content);
    }

    private boolean isExtractable(String text) {
        return text != null && text.strip().length() > minTextLength;
    }

    static String detectMimeType(byte[] content, String filename) {
        if (startsWith(content, '%', 'P', 'D', 'F')) {
            return PDF;
        }
        if (startsWith(content, 0x89, 'P', 'N', 'G')) {
            return "image/png";
        }
        if (startsWith(content, 0xFF, 0xD8, 0xFF)) {
            return "image/jpeg";
        }
        if (startsWith(content, 'G', 'I', 'F', '8')) {
            return "image/gif";
        }
        if (startsWith(content, 'R', 'I', 'F', 'F') && content.length >= 12
            && content[8] == 'W' && content[9] == 'E' && content[10] == 'B' && content[11] == 'P') {
            return "image/webp";
        }

        if (filename != null) {
            int dot = filename.lastIndexOf('.');
            if (dot >= 0 && dot < filename.length() - 1) {
                String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
                return MIME_BY_EXTENSION.getOrDefault(extension, OCTET_STREAM);
            }
        }
        return OCTET_STREAM;
    }

    private static boolean startsWith(byte[] content, int... prefix) {
        if (content == null || content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((content[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
