package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchRequest(
    @JsonProperty("output_language")
    String outputLanguage,

    @NotEmpty
    List<@Valid BatchDocumentRequest> documents
) {}
