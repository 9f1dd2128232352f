package com.nevis.dossier.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.RiskLevel;
import com.nevis.dossier.model.Synthesis;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcSynthesisRepository implements SynthesisRepository {

    private static final String NO_CATEGORY = "";

    private final JdbcClient jdbcClient;

    private final ObjectMapper objectMapper;

    private final RowMapper<Synthesis> synthesisRowMapper = (rs, rowNum) -> {
        SynthesisBody body = readBody(rs.getString("synthesis_data"));
        String category = rs.getString("category");
        return new Synthesis(
            rs.getObject("id", UUID.class),
            rs.getObject("case_id", UUID.class),
            category != null ? DocumentCategory.valueOf(category) : null,
            rs.getString("summary"),
            RiskLevel.valueOf(rs.getString("risk_level")),
            rs.getBigDecimal("total_annual_cost"),
            rs.getBigDecimal("total_one_time_cost"),
            body.annualCostBreakdown(),
            body.oneTimeCostBreakdown(),
            body.keyFindings(),
            body.recommendations(),
            body.crossDocumentThemes(),
            rs.getString("overrides"),
            rs.getInt("document_count"),
            rs.getObject("last_updated", OffsetDateTime.class)
        );
    };

    @Override
    public Optional<Synthesis> find(UUID caseId, DocumentCategory category) {
        return jdbcClient.sql("""
                SELECT * FROM syntheses
                WHERE case_id = :caseId
                  AND COALESCE(category, '') = :category
                """)
            .param("caseId", caseId)
            .param("category", categoryKey(category))
            .query(synthesisRowMapper)
            .optional();
    }

    @Override
    public Optional<Synthesis> findForUpdate(UUID caseId, DocumentCategory category) {
        return jdbcClient.sql("""
                SELECT * FROM syntheses
                WHERE case_id = :caseId
                  AND COALESCE(category, '') = :category
                FOR UPDATE
                """)
            .param("caseId", caseId)
            .param("category", categoryKey(category))
            .query(synthesisRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public Synthesis upsert(Synthesis synthesis) {
        String sql = """
            INSERT INTO syntheses (case_id, category, summary, risk_level, total_annual_cost, total_one_time_cost,
                                   synthesis_data, overrides, document_count, last_updated)
            VALUES (:caseId, :category, :summary, :riskLevel, :annualCost, :oneTimeCost,
                    :body, :overrides, :documentCount, NOW())
            ON CONFLICT (case_id, COALESCE(category, ''))
            DO UPDATE SET summary = EXCLUDED.summary,
                          risk_level = EXCLUDED.risk_level,
                          total_annual_cost = EXCLUDED.total_annual_cost,
                          total_one_time_cost = EXCLUDED.total_one_time_cost,
                          synthesis_data = EXCLUDED.synthesis_data,
                          document_count = EXCLUDED.document_count,
                          last_updated = NOW()
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("caseId", synthesis.caseId())
            .param("category", synthesis.category() != null ? synthesis.category().name() : null)
            .param("summary", synthesis.summary())
            .param("riskLevel", synthesis.riskLevel().name())
            .param("annualCost", synthesis.totalAnnualCost())
            .param("oneTimeCost", synthesis.totalOneTimeCost())
            .param("body", writeBody(synthesis))
            .param("overrides", synthesis.overridesJson())
            .param("documentCount", synthesis.documentCount())
            .query(synthesisRowMapper)
            .single();
    }

    @Override
    @Transactional
    public boolean updateOverrides(UUID caseId, DocumentCategory category, String overridesJson) {
        String sql = """
            UPDATE syntheses
            SET overrides = :overrides
            WHERE case_id = :caseId
              AND COALESCE(category, '') = :category
            """;

        return jdbcClient.sql(sql)
            .param("overrides", overridesJson)
            .param("caseId", caseId)
            .param("category", categoryKey(category))
            .update() == 1;
    }

    @Override
    @Transactional
    public boolean delete(UUID caseId, DocumentCategory category) {
        return jdbcClient.sql("DELETE FROM syntheses WHERE case_id = :caseId AND COALESCE(category, '') = :category")
            .param("caseId", caseId)
            .param("category", categoryKey(category))
            .update() == 1;
    }

    private static String categoryKey(DocumentCategory category) {
        return category != null ? category.name() : NO_CATEGORY;
    }

    private String writeBody(Synthesis synthesis) {
        SynthesisBody body = new SynthesisBody(
            synthesis.keyFindings(),
            synthesis.recommendations(),
            synthesis.annualCostBreakdown(),
            synthesis.oneTimeCostBreakdown(),
            synthesis.crossDocumentThemes()
        );
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Synthesis body cannot be serialized", e);
        }
    }

    private SynthesisBody readBody(String json) {
        try {
            SynthesisBody body = objectMapper.readValue(json, SynthesisBody.class);
            return new SynthesisBody(
                body.keyFindings() != null ? body.keyFindings() : List.of(),
                body.recommendations() != null ? body.recommendations() : List.of(),
                body.annualCostBreakdown() != null ? body.annualCostBreakdown() : Map.of(),
                body.oneTimeCostBreakdown() != null ? body.oneTimeCostBreakdown() : Map.of(),
                body.crossDocumentThemes() != null ? body.crossDocumentThemes() : List.of()
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored synthesis body is not readable", e);
        }
    }

    record SynthesisBody(
        List<String> keyFindings,
        List<String> recommendations,
        Map<String, BigDecimal> annualCostBreakdown,
        Map<String, BigDecimal> oneTimeCostBreakdown,
        List<String> crossDocumentThemes
    ) {}
}
