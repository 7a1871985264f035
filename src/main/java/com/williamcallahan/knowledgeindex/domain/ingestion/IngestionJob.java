package com.williamcallahan.knowledgeindex.domain.ingestion;

import java.util.Objects;
import java.util.UUID;

/**
 * One unit of background ingestion work.
 *
 * @param jobId job identifier
 * @param documentId document to (re)index; reused across re-ingestions
 * @param path logical path of the stored content
 * @param options options snapshot taken at enqueue time
 * @param batchId reindex batch that produced the job, empty otherwise
 */
public record IngestionJob(String jobId, String documentId, String path, IngestionOptions options, String batchId) {

    public IngestionJob {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(options, "options");
        batchId = batchId == null ? "" : batchId;
    }

    public static IngestionJob create(String documentId, String path, IngestionOptions options, String batchId) {
        return new IngestionJob(UUID.randomUUID().toString(), documentId, path, options, batchId);
    }

    public String scopeId() {
        return options.scopeId();
    }
}
