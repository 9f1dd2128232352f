package com.nevis.dossier.model;

import com.nevis.dossier.model.extraction.DocumentExtraction;

public record DocumentAnalysis(
    DocumentCategory category,
    DocumentExtraction extraction,
    int pageCount,
    boolean textExtractable
) {}
