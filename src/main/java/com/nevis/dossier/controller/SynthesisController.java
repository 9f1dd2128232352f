package com.nevis.dossier.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.service.SynthesisService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/cases/{caseId}/synthesis")
public class SynthesisController {

    private final SynthesisService synthesisService;

    @GetMapping
    public ResponseEntity<SynthesisResponse> getSynthesis(
        @PathVariable UUID caseId,
        @RequestParam(required = false) DocumentCategory category) {

        return ResponseEntity.ok(synthesisService.get(caseId, category));
    }

    @PostMapping("/regenerate")
    public ResponseEntity<SynthesisResponse> regenerate(
        @PathVariable UUID caseId,
        @RequestParam(required = false) DocumentCategory category,
        @RequestParam(name = "output_language", required = false) String outputLanguage) {

        return synthesisService.regenerate(caseId, category, outputLanguage)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PatchMapping("/overrides")
    public ResponseEntity<SynthesisResponse> updateOverrides(
        @PathVariable UUID caseId,
        @RequestBody JsonNode patch) {

        return ResponseEntity.ok(synthesisService.updateOverrides(caseId, patch));
    }
}
