package com.nevis.dossier.model;

public record BatchProgress(
    int total,
    int completed,
    int failed,
    int processing,
    int pending,
    int percentage
) {}
