package com.nevis.dossier.model;

import com.nevis.dossier.model.extraction.DocumentExtraction;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record Document(
    UUID id,
    UUID caseId,
    UUID batchId,
    Integer batchPosition,
    String filename,
    String blobKey,
    DocumentCategory category,
    String subcategory,
    DocumentExtraction extraction,
    String summary,
    List<String> keyInsights,
    BigDecimal estimatedAnnualCost,
    BigDecimal oneTimeCost,
    Integer pageCount,
    Boolean textExtractable,
    DocumentStatus status,
    OffsetDateTime processingStartedAt,
    OffsetDateTime processingCompletedAt,
    String processingError,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static Document pending(UUID id, UUID caseId, UUID batchId, int position, String filename, String blobKey) {
        return new Document(
            id,
            caseId,
            batchId,
            position,
            filename,
            blobKey,
            DocumentCategory.UNCLASSIFIED,
            null,
            null,
            null,
            List.of(),
            null,
            null,
            null,
            null,
            DocumentStatus.PENDING,
            null,
            null,
            null,
            null,
            null
        );
    }
}
