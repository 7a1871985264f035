package com.williamcallahan.knowledgeindex.domain.ingestion;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of running the ingestion pipeline for one document.
 *
 * @param documentId document that was processed
 * @param success whether the document reached READY
 * @param chunkCount number of chunks stored
 * @param contentHash SHA-256 of the processed bytes, empty when hashing never happened
 * @param duration wall-clock time spent
 * @param errorMessage failure message, empty on success
 * @param warnings parser and chunker warnings
 */
public record IngestionResult(
        String documentId,
        boolean success,
        int chunkCount,
        String contentHash,
        Duration duration,
        String errorMessage,
        List<String> warnings) {

    public IngestionResult {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(duration, "duration");
        contentHash = contentHash == null ? "" : contentHash;
        errorMessage = errorMessage == null ? "" : errorMessage;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
