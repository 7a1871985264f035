package com.williamcallahan.knowledgeindex.domain.ingestion;

/**
 * Execution state of an ingestion job.
 */
public enum IngestionJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
