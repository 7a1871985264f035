package com.williamcallahan.knowledgeindex.domain.ingestion;

/**
 * Pipeline phase reported while a job runs, with the progress percentage it represents.
 */
public enum IngestionPhase {
    PARSING(10),
    CHUNKING(30),
    EMBEDDING(50),
    STORING(80),
    COMPLETE(100);

    private final int percentComplete;

    IngestionPhase(int percentComplete) {
        this.percentComplete = percentComplete;
    }

    public int percentComplete() {
        return percentComplete;
    }
}
