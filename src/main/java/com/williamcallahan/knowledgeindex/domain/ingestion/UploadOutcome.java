package com.williamcallahan.knowledgeindex.domain.ingestion;

import java.util.Objects;

/**
 * Result of registering uploaded content for ingestion.
 *
 * @param documentId document id assigned or reused for the path
 * @param jobId job that will index the content, empty when no job was enqueued
 * @param duplicate true when identical bytes were already indexed and nothing was queued
 * @param enqueueResult queue outcome; {@link EnqueueResult#ACCEPTED} for duplicates
 */
public record UploadOutcome(String documentId, String jobId, boolean duplicate, EnqueueResult enqueueResult) {

    public UploadOutcome {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(enqueueResult, "enqueueResult");
        jobId = jobId == null ? "" : jobId;
    }
}
