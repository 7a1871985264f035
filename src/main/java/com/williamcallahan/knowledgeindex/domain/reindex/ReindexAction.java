package com.williamcallahan.knowledgeindex.domain.reindex;

/**
 * What a reindex batch did with one document.
 */
public enum ReindexAction {
    ENQUEUED,
    SKIPPED,
    FAILED
}
