package com.nevis.dossier.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentAnalysis;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.model.extraction.DocumentExtraction;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcClient jdbcClient;

    private final ObjectMapper objectMapper;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getObject("id", UUID.class),
        rs.getObject("case_id", UUID.class),
        rs.getObject("batch_id", UUID.class),
        (Integer) rs.getObject("batch_position"),
        rs.getString("filename"),
        rs.getString("blob_key"),
        DocumentCategory.valueOf(rs.getString("category")),
        rs.getString("subcategory"),
        readExtraction(rs.getString("extracted_data")),
        rs.getString("summary"),
        readStringList(rs.getString("key_insights")),
        rs.getBigDecimal("estimated_annual_cost"),
        rs.getBigDecimal("one_time_cost"),
        (Integer) rs.getObject("page_count"),
        (Boolean) rs.getObject("text_extractable"),
        DocumentStatus.valueOf(rs.getString("status")),
        rs.getObject("processing_started_at", OffsetDateTime.class),
        rs.getObject("processing_completed_at", OffsetDateTime.class),
        rs.getString("processing_error"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (id, case_id, batch_id, batch_position, filename, blob_key, category, status)
                VALUES (:id, :caseId, :batchId, :position, :filename, :blobKey,
                        :category, :status::processing_status)
                RETURNING *
                """)
            .param("id", document.id())
            .param("caseId", document.caseId())
            .param("batchId", document.batchId())
            .param("position", document.batchPosition())
            .param("filename", document.filename())
            .param("blobKey", document.blobKey())
            .param("category", document.category() != null ? document.category().name() : DocumentCategory.UNCLASSIFIED.name())
            .param("status", document.status() != null ? document.status().name() : DocumentStatus.PENDING.name())
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public List<Document> findByBatchId(UUID batchId) {
        return jdbcClient.sql("SELECT * FROM documents WHERE batch_id = :batchId ORDER BY batch_position, id")
            .param("batchId", batchId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<Document> findCompletedByCaseId(UUID caseId) {
        return jdbcClient.sql("""
                SELECT * FROM documents
                WHERE case_id = :caseId
                  AND status = 'COMPLETED'::processing_status
                ORDER BY created_at, id
                """)
            .param("caseId", caseId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<Document> findCompletedByCaseIdAndCategory(UUID caseId, DocumentCategory category) {
        return jdbcClient.sql("""
                SELECT * FROM documents
                WHERE case_id = :caseId
                  AND category = :category
                  AND status = 'COMPLETED'::processing_status
                ORDER BY created_at, id
                """)
            .param("caseId", caseId)
            .param("category", category.name())
            .query(documentRowMapper)
            .list();
    }

    @Override
    public boolean attachToBatch(UUID documentId, UUID caseId, UUID batchId, int position, String filename, String blobKey) {
        String sql = """
            UPDATE documents
            SET batch_id = :batchId,
                batch_position = :position,
                filename = :filename,
                blob_key = :blobKey
            WHERE id = :id
              AND case_id = :caseId
              AND status = 'PENDING'::processing_status
            """;

        return jdbcClient.sql(sql)
            .param("batchId", batchId)
            .param("position", position)
            .param("filename", filename)
            .param("blobKey", blobKey)
            .param("id", documentId)
            .param("caseId", caseId)
            .update() == 1;
    }

    @Override
    @Transactional
    public int markProcessing(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = """
            UPDATE documents
            SET status = 'PROCESSING'::processing_status,
                processing_started_at = NOW(),
                processing_error = NULL
            WHERE id IN (:ids)
              AND status = 'PENDING'::processing_status
            """;

        return jdbcClient.sql(sql)
            .param("ids", ids)
            .update();
    }

    @Override
    @Transactional
    public boolean markCompleted(UUID id, DocumentAnalysis analysis) {
        DocumentExtraction extraction = analysis.extraction();
        String sql = """
            UPDATE documents
            SET status = 'COMPLETED'::processing_status,
                category = :category,
                subcategory = :subcategory,
                extracted_data = :extractedData,
                summary = :summary,
                key_insights = :keyInsights,
                estimated_annual_cost = :annualCost,
                one_time_cost = :oneTimeCost,
                page_count = :pageCount,
                text_extractable = :textExtractable,
                processing_completed_at = NOW(),
                processing_error = NULL
            WHERE id = :id
              AND status = 'PROCESSING'::processing_status
            """;

        return jdbcClient.sql(sql)
            .param("category", analysis.category().name())
            .param("subcategory", extraction.subcategory())
            .param("extractedData", writeJson(extraction))
            .param("summary", extraction.summary())
            .param("keyInsights", writeJson(extraction.keyInsights()))
            .param("annualCost", extraction.estimatedAnnualCost() != null ? extraction.estimatedAnnualCost() : BigDecimal.ZERO)
            .param("oneTimeCost", extraction.totalOneTimeCost())
            .param("pageCount", analysis.pageCount())
            .param("textExtractable", analysis.textExtractable())
            .param("id", id)
            .update() == 1;
    }

    @Override
    @Transactional
    public boolean markFailed(UUID id, String error) {
        return markAllFailed(List.of(id), error) == 1;
    }

    @Override
    @Transactional
    public int markAllFailed(Collection<UUID> ids, String error) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = """
            UPDATE documents
            SET status = 'FAILED'::processing_status,
                processing_error = :error,
                processing_completed_at = NOW()
            WHERE id IN (:ids)
              AND status IN ('PENDING'::processing_status, 'PROCESSING'::processing_status)
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("ids", ids)
            .update();
    }

    @Override
    @Transactional
    public List<UUID> failStaleProcessing(int staleThresholdMinutes, String error) {
        String sql = """
            UPDATE documents
            SET status = 'FAILED'::processing_status,
                processing_error = :error,
                processing_completed_at = NOW()
            WHERE id IN (
                SELECT id FROM documents
                WHERE status = 'PROCESSING'::processing_status
                  AND processing_started_at < NOW() - (INTERVAL '1 minute' * :staleMins)
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("staleMins", staleThresholdMinutes)
            .query(UUID.class)
            .list();
    }

    /**
     * Fails batch members still PENDING after their batch has existed past the threshold: their
     * coordinator run was lost or never scheduled. Documents outside any batch are left alone.
     */
    @Override
    @Transactional
    public List<UUID> failStalePending(int staleThresholdMinutes, String error) {
        String sql = """
            UPDATE documents
            SET status = 'FAILED'::processing_status,
                processing_error = :error,
                processing_completed_at = NOW()
            WHERE id IN (
                SELECT d.id FROM documents d
                JOIN batches b ON b.id = d.batch_id
                WHERE d.status = 'PENDING'::processing_status
                  AND b.created_at < NOW() - (INTERVAL '1 minute' * :staleMins)
                FOR UPDATE OF d SKIP LOCKED
            )
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("staleMins", staleThresholdMinutes)
            .query(UUID.class)
            .list();
    }

    @Override
    @Transactional
    public boolean deleteById(UUID id) {
        return jdbcClient.sql("DELETE FROM documents WHERE id = :id")
            .param("id", id)
            .update() == 1;
    }

    private DocumentExtraction readExtraction(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, DocumentExtraction.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored extraction is not readable", e);
        }
    }

    private List<String> readStringList(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored key insights are not readable", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to JSON", e);
        }
    }
}
