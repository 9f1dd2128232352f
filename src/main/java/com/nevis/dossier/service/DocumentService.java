package com.nevis.dossier.service;

import com.nevis.dossier.controller.DocumentResponse;

import java.util.UUID;

public interface DocumentService {
    DocumentResponse getById(UUID id);
    void delete(UUID id, String outputLanguage);
}
