package com.nevis.dossier.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
