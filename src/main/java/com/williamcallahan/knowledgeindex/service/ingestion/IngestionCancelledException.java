package com.williamcallahan.knowledgeindex.service.ingestion;

/**
 * Signals that an ingestion job was cancelled, either individually or by shutdown.
 *
 * <p>Distinct from failures: generic error handling must rethrow it so the job is recorded as cancelled,
 * never as failed.</p>
 */
public class IngestionCancelledException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the cancellation
     */
    public IngestionCancelledException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the cancellation
     * @param cause interruption or failure that revealed the cancellation
     */
    public IngestionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
