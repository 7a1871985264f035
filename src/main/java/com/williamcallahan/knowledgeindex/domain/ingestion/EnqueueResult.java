package com.williamcallahan.knowledgeindex.domain.ingestion;

/**
 * Outcome of offering a job to the bounded ingestion queue.
 */
public enum EnqueueResult {
    ACCEPTED,
    /** The queue is at capacity; the job was not accepted and nothing was recorded for it. */
    QUEUE_FULL;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
