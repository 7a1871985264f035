package com.williamcallahan.knowledgeindex.domain.reindex;

import java.util.Objects;

/**
 * Per-document entry of a reindex batch.
 *
 * @param documentId evaluated document
 * @param reason evaluation outcome
 * @param action what the batch did
 * @param jobId enqueued job id, empty unless enqueued
 * @param message diagnostic message, empty when none
 */
public record ReindexDocumentResult(
        String documentId, ReindexReason reason, ReindexAction action, String jobId, String message) {

    public ReindexDocumentResult {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(action, "action");
        jobId = jobId == null ? "" : jobId;
        message = message == null ? "" : message;
    }
}
