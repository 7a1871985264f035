package com.williamcallahan.knowledgeindex.domain.ingestion;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time status of an ingestion job.
 *
 * @param jobId job identifier
 * @param documentId document the job indexes
 * @param state execution state
 * @param phase current pipeline phase, null while queued
 * @param percentComplete progress from 0 to 100
 * @param errorMessage failure or cancellation message, empty otherwise
 * @param queuedAt enqueue time
 * @param startedAt time a worker picked the job up, null while queued
 * @param completedAt time a terminal state was reached, null until then
 */
public record IngestionJobStatus(
        String jobId,
        String documentId,
        IngestionJobState state,
        IngestionPhase phase,
        int percentComplete,
        String errorMessage,
        Instant queuedAt,
        Instant startedAt,
        Instant completedAt) {

    public IngestionJobStatus {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(queuedAt, "queuedAt");
        errorMessage = errorMessage == null ? "" : errorMessage;
        percentComplete = Math.max(0, Math.min(100, percentComplete));
    }

    public static IngestionJobStatus queued(IngestionJob job, Instant now) {
        return new IngestionJobStatus(
                job.jobId(), job.documentId(), IngestionJobState.QUEUED, null, 0, "", now, null, null);
    }

    public Optional<IngestionPhase> currentPhase() {
        return Optional.ofNullable(phase);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public IngestionJobStatus processing(Instant now) {
        return new IngestionJobStatus(
                jobId, documentId, IngestionJobState.PROCESSING, IngestionPhase.PARSING, 0, "", queuedAt, now, null);
    }

    public IngestionJobStatus inPhase(IngestionPhase newPhase) {
        return new IngestionJobStatus(
                jobId, documentId, state, newPhase, newPhase.percentComplete(), errorMessage, queuedAt, startedAt,
                completedAt);
    }

    public IngestionJobStatus completed(Instant now) {
        return new IngestionJobStatus(
                jobId, documentId, IngestionJobState.COMPLETED, IngestionPhase.COMPLETE, 100, "", queuedAt, startedAt,
                now);
    }

    public IngestionJobStatus failed(String message, Instant now) {
        return new IngestionJobStatus(
                jobId, documentId, IngestionJobState.FAILED, phase, percentComplete, message, queuedAt, startedAt, now);
    }

    public IngestionJobStatus cancelled(String message, Instant now) {
        return new IngestionJobStatus(
                jobId, documentId, IngestionJobState.CANCELLED, phase, percentComplete, message, queuedAt, startedAt,
                now);
    }
}
