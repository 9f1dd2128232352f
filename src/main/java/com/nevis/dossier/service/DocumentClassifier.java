package com.nevis.dossier.service;

import com.nevis.dossier.inference.InferenceClient;
import com.nevis.dossier.inference.InferenceContent;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.PreparedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentClassifier {

    private final InferenceClient inferenceClient;

    @Value("${app.classification.max-tokens:50}")
    private int maxTokens;

    /**
     * Never throws: unknown labels and failed calls both resolve to {@link DocumentCategory#OTHER}.
     */
    public DocumentCategory classify(PreparedDocument document) {
        String answer;
        try {
            answer = inferenceClient.infer(
                contentOf(document),
                PromptTemplates.classification(document.filename()),
                maxTokens,
                false
            );
        } catch (Exception e) {
            log.warn("Doc {}: classification failed, falling back to other: {}", document.documentId(), e.getMessage());
            return DocumentCategory.OTHER;
        }

        String label = normalize(answer);
        DocumentCategory category = DocumentCategory.fromLabel(label).orElse(DocumentCategory.OTHER);
        if (category == DocumentCategory.OTHER && !DocumentCategory.OTHER.label().equals(label)) {
            log.warn("Doc {}: unexpected classification label '{}', using other", document.documentId(), label);
        }
        log.info("Doc {} classified as {}", document.documentId(), category.label());
        return category;
    }

    static InferenceContent contentOf(PreparedDocument document) {
        if (document.textExtractable() && document.text() != null) {
            return InferenceContent.ofText(document.text());
        }
        return InferenceContent.ofBinary(document.content(), document.mimeType());
    }

    static String normalize(String answer) {
        if (answer == null) {
            return "";
        }
        String label = answer.strip().toLowerCase(Locale.ROOT);
        label = label.replaceAll("^[\\s\"'`*]+", "");
        label = label.replaceAll("[\\s\"'`*.,;:!]+$", "");
        return label;
    }
}
