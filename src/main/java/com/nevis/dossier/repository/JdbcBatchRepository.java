package com.nevis.dossier.repository;

import com.nevis.dossier.model.Batch;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcBatchRepository implements BatchRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Batch> batchRowMapper = (rs, rowNum) -> new Batch(
        rs.getObject("id", UUID.class),
        rs.getObject("case_id", UUID.class),
        rs.getString("output_language"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public Batch save(UUID caseId, String outputLanguage) {
        return jdbcClient.sql("""
                INSERT INTO batches (case_id, output_language)
                VALUES (:caseId, :outputLanguage)
                RETURNING *
                """)
            .param("caseId", caseId)
            .param("outputLanguage", outputLanguage)
            .query(batchRowMapper)
            .single();
    }

    @Override
    public Optional<Batch> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM batches WHERE id = :id")
            .param("id", id)
            .query(batchRowMapper)
            .optional();
    }
}
