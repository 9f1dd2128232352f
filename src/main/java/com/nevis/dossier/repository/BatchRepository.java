package com.nevis.dossier.repository;

import com.nevis.dossier.model.Batch;

import java.util.Optional;
import java.util.UUID;

public interface BatchRepository {
    Batch save(UUID caseId, String outputLanguage);
    Optional<Batch> findById(UUID id);
}
