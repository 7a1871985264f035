package com.williamcallahan.knowledgeindex.store;

/**
 * Raised when original document bytes cannot be written to or read from the content store.
 */
public class ContentStoreException extends RuntimeException {

    /**
     * Creates a content store failure with a descriptive message.
     *
     * @param message failure description
     */
    public ContentStoreException(String message) {
        super(message);
    }

    /**
     * Creates a content store failure wrapping the underlying I/O cause.
     *
     * @param message failure description
     * @param cause underlying cause
     */
    public ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
