package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionPhase;

/**
 * Callback the pipeline invokes when it enters a new phase.
 */
@FunctionalInterface
public interface IngestionPhaseListener {

    IngestionPhaseListener NONE = phase -> {};

    void onPhase(IngestionPhase phase);
}
