package com.nevis.dossier.worker;

import com.nevis.dossier.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Fails documents left behind by a crashed, stuck or never-started run: PROCESSING for too long,
 * or still PENDING in a batch older than the threshold. Documents are not retried.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StaleDocumentWorker {

    static final String TIMEOUT_ERROR = "Processing timed out";
    static final String NEVER_STARTED_ERROR = "Processing never started";

    private final DocumentRepository documentRepository;

    @Value("${app.worker.stale.threshold-minutes:30}")
    private int staleThresholdMinutes;

    @Scheduled(fixedDelayString = "${app.worker.stale.interval-ms:60000}")
    public void failStaleDocuments() {
        log.debug("Checking for stale PROCESSING and PENDING documents...");

        List<UUID> timedOut = documentRepository.failStaleProcessing(staleThresholdMinutes, TIMEOUT_ERROR);
        if (!timedOut.isEmpty()) {
            log.warn("Marked {} stale documents FAILED: {}", timedOut.size(), timedOut);
        }

        List<UUID> neverStarted = documentRepository.failStalePending(staleThresholdMinutes, NEVER_STARTED_ERROR);
        if (!neverStarted.isEmpty()) {
            log.warn("Marked {} never-started documents FAILED: {}", neverStarted.size(), neverStarted);
        }
    }
}
