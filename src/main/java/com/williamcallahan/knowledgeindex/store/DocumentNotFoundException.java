package com.williamcallahan.knowledgeindex.store;

/**
 * Signals that a document id is not registered.
 */
public class DocumentNotFoundException extends RuntimeException {

    /**
     * Creates an exception naming the missing document.
     *
     * @param documentId id that was looked up
     */
    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
    }
}
