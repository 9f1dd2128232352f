package com.nevis.dossier.repository;

import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.Synthesis;

import java.util.Optional;
import java.util.UUID;

/**
 * One row per (case, category); a {@code null} category addresses the overall synthesis.
 */
public interface SynthesisRepository {

    Optional<Synthesis> find(UUID caseId, DocumentCategory category);

    /**
     * Same as {@link #find} but locks the row until the surrounding transaction ends.
     */
    Optional<Synthesis> findForUpdate(UUID caseId, DocumentCategory category);

    /**
     * Inserts a synthesis or replaces the generated fields of the existing row. On replace the stored
     * overrides are left as they are; {@link Synthesis#overridesJson()} is only written for new rows.
     */
    Synthesis upsert(Synthesis synthesis);

    boolean updateOverrides(UUID caseId, DocumentCategory category, String overridesJson);

    boolean delete(UUID caseId, DocumentCategory category);
}
