package com.williamcallahan.knowledgeindex.service.embedding;

/**
 * Signals that the configured embedding provider is unavailable or returned an invalid response.
 *
 * <p>Thrown instead of returning synthetic vectors so a document whose chunks cannot be embedded is marked
 * failed rather than indexed with unusable vectors.</p>
 */
public class EmbeddingServiceUnavailableException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the embedding failure
     */
    public EmbeddingServiceUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the embedding failure
     * @param cause underlying exception from the provider call
     */
    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
