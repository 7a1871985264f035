package com.williamcallahan.knowledgeindex.domain.document;

/**
 * Lifecycle of a registered document.
 */
public enum DocumentStatus {
    PENDING,
    PROCESSING,
    READY,
    FAILED
}
