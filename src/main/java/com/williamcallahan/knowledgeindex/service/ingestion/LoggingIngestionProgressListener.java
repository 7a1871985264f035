package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes job progress to the {@code INDEXING} log.
 */
@Component
public class LoggingIngestionProgressListener implements IngestionProgressListener {

    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    @Override
    public void onProgress(IngestionJobStatus status) {
        if (status.isTerminal()) {
            INDEXING_LOG.info(
                    "[INDEXING] Job {} for document {} finished: {}{}",
                    status.jobId(),
                    status.documentId(),
                    status.state(),
                    status.errorMessage().isEmpty() ? "" : " (" + status.errorMessage() + ")");
            return;
        }
        INDEXING_LOG.debug(
                "[INDEXING] Job {} for document {}: {} {}%",
                status.jobId(),
                status.documentId(),
                status.currentPhase().map(Enum::name).orElse(status.state().name()),
                status.percentComplete());
    }
}
