package com.nevis.dossier.controller;

import com.nevis.dossier.service.DocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @GetMapping("/documents/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
        DocumentResponse response = documentService.getById(id);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/documents/{id}")
    public ResponseEntity<Void> deleteDocument(
        @PathVariable UUID id,
        @RequestParam(name = "output_language", required = false) String outputLanguage) {

        documentService.delete(id, outputLanguage);
        return ResponseEntity.noContent().build();
    }
}
