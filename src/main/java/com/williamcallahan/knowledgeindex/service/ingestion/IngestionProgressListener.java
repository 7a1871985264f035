package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;

/**
 * Receives job status snapshots. Called off the worker threads; implementations must not block for long.
 */
@FunctionalInterface
public interface IngestionProgressListener {

    void onProgress(IngestionJobStatus status);
}
