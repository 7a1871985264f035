package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.domain.ingestion.EnqueueResult;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionBatchStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobState;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionPhase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Bounded FIFO of ingestion jobs plus the status of every job it has seen.
 *
 * <p>Enqueueing never blocks longer than the caller allows and never drops work silently: a full queue
 * is reported as {@link EnqueueResult#QUEUE_FULL}. Terminal statuses are never overwritten, which is
 * what makes cancellation safe against a job completing at the same moment.</p>
 */
@Component
public class IngestionQueue {
    private static final Logger log = LoggerFactory.getLogger(IngestionQueue.class);

    private final BlockingQueue<IngestionJob> pending;
    private final Map<String, IngestionJobStatus> statusesByJob = new ConcurrentHashMap<>();
    private final Map<String, String> jobIdsByDocument = new ConcurrentHashMap<>();
    private final Map<String, CancellationScope> runningScopes = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> jobIdsByBatch = new ConcurrentHashMap<>();
    private final IngestionProgressBroadcaster broadcaster;
    private final Duration statusRetention;
    private final Clock clock;

    @Autowired
    public IngestionQueue(AppProperties appProperties, IngestionProgressBroadcaster broadcaster) {
        this(
                appProperties.getIngestion().getQueueCapacity(),
                appProperties.getIngestion().getStatusRetention(),
                broadcaster,
                Clock.systemUTC());
    }

    IngestionQueue(int capacity, Duration statusRetention, IngestionProgressBroadcaster broadcaster, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        this.pending = new ArrayBlockingQueue<>(capacity);
        this.statusRetention = Objects.requireNonNull(statusRetention, "statusRetention");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Offers a job without waiting.
     */
    public EnqueueResult tryEnqueue(IngestionJob job) {
        Objects.requireNonNull(job, "job");
        IngestionJobStatus queued = register(job);
        String previousJobId = jobIdsByDocument.put(job.documentId(), job.jobId());
        if (!pending.offer(job)) {
            return rejectFull(job, previousJobId);
        }
        return accept(job, queued, previousJobId);
    }

    /**
     * Offers a job, waiting up to {@code timeout} for space.
     */
    public EnqueueResult enqueue(IngestionJob job, Duration timeout) {
        Objects.requireNonNull(job, "job");
        IngestionJobStatus queued = register(job);
        String previousJobId = jobIdsByDocument.put(job.documentId(), job.jobId());
        try {
            if (!pending.offer(job, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return rejectFull(job, previousJobId);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return rejectFull(job, previousJobId);
        }
        return accept(job, queued, previousJobId);
    }

    private IngestionJobStatus register(IngestionJob job) {
        IngestionJobStatus queued = IngestionJobStatus.queued(job, clock.instant());
        statusesByJob.put(job.jobId(), queued);
        if (!job.batchId().isEmpty()) {
            jobIdsByBatch.computeIfAbsent(job.batchId(), id -> ConcurrentHashMap.newKeySet()).add(job.jobId());
        }
        return queued;
    }

    /**
     * Cancels the job this one replaced for the same document. The document mapping is registered before
     * the offer so a worker finishing the job at once still releases its own entry.
     */
    private EnqueueResult accept(IngestionJob job, IngestionJobStatus queued, String previousJobId) {
        if (previousJobId != null && !previousJobId.equals(job.jobId())) {
            cancelJob(previousJobId, "Superseded by job " + job.jobId());
        }
        log.debug("[INDEXING] Queued job {} for document {}", job.jobId(), job.documentId());
        broadcaster.publish(queued);
        return EnqueueResult.ACCEPTED;
    }

    private EnqueueResult rejectFull(IngestionJob job, String previousJobId) {
        statusesByJob.remove(job.jobId());
        forgetBatchMember(job.batchId(), job.jobId());
        boolean previousStillActive = previousJobId != null
                && Optional.ofNullable(statusesByJob.get(previousJobId))
                        .map(status -> !status.isTerminal())
                        .orElse(false);
        if (previousStillActive) {
            jobIdsByDocument.replace(job.documentId(), job.jobId(), previousJobId);
        } else {
            jobIdsByDocument.remove(job.documentId(), job.jobId());
        }
        log.warn("[INDEXING] Queue full, rejected job for document {}", job.documentId());
        return EnqueueResult.QUEUE_FULL;
    }

    private void forgetBatchMember(String batchId, String jobId) {
        if (batchId.isEmpty()) {
            return;
        }
        jobIdsByBatch.computeIfPresent(batchId, (id, members) -> {
            members.remove(jobId);
            return members.isEmpty() ? null : members;
        });
    }

    /**
     * Waits up to {@code pollTimeout} for the next job that has not been cancelled while queued.
     *
     * @return next runnable job, or empty when the wait timed out
     */
    public Optional<IngestionJob> poll(Duration pollTimeout) throws InterruptedException {
        long deadline = System.nanoTime() + pollTimeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            IngestionJob job = pending.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            if (job == null) {
                return Optional.empty();
            }
            IngestionJobStatus status = statusesByJob.get(job.jobId());
            if (status != null && !status.isTerminal()) {
                return Optional.of(job);
            }
            log.debug("[INDEXING] Skipping cancelled job {}", job.jobId());
        }
    }

    /**
     * Moves a dequeued job to PROCESSING under the given scope.
     *
     * @return false when the job was cancelled before it could start
     */
    public boolean markStarted(IngestionJob job, CancellationScope scope) {
        runningScopes.put(job.jobId(), scope);
        Optional<IngestionJobStatus> started = transition(job.jobId(), status -> status.state() == IngestionJobState.QUEUED
                ? status.processing(clock.instant())
                : status);
        boolean running = started.map(status -> status.state() == IngestionJobState.PROCESSING).orElse(false);
        if (!running) {
            runningScopes.remove(job.jobId());
        }
        return running;
    }

    public void updatePhase(String jobId, IngestionPhase phase) {
        transition(jobId, status -> status.inPhase(phase));
    }

    public void markCompleted(IngestionJob job) {
        transition(job.jobId(), status -> status.completed(clock.instant()));
        release(job);
    }

    public void markFailed(IngestionJob job, String message) {
        transition(job.jobId(), status -> status.failed(message, clock.instant()));
        release(job);
    }

    public void markCancelled(IngestionJob job, String message) {
        transition(job.jobId(), status -> status.cancelled(message, clock.instant()));
        release(job);
    }

    private void release(IngestionJob job) {
        runningScopes.remove(job.jobId());
        jobIdsByDocument.remove(job.documentId(), job.jobId());
    }

    /**
     * Cancels the queued or running job currently registered for a document.
     *
     * @return true when a non-terminal job was found and cancelled
     */
    public boolean cancelJobForDocument(String documentId) {
        String jobId = jobIdsByDocument.get(documentId);
        if (jobId == null) {
            return false;
        }
        return cancelJob(jobId, "Cancelled by request");
    }

    /**
     * Cancels a job. A running job observes the cancellation at its next phase boundary; a queued job is
     * marked CANCELLED at once and skipped when dequeued.
     */
    public boolean cancelJob(String jobId, String reason) {
        CancellationScope running = runningScopes.get(jobId);
        if (running != null) {
            running.cancel(reason);
            log.info("[INDEXING] Cancellation requested for running job {}", jobId);
            return true;
        }
        Optional<IngestionJobStatus> updated = transition(jobId, status -> status.state() == IngestionJobState.QUEUED
                ? status.cancelled(reason, clock.instant())
                : status);
        boolean cancelled = updated.map(status -> status.state() == IngestionJobState.CANCELLED).orElse(false);
        if (cancelled) {
            IngestionJobStatus status = updated.get();
            jobIdsByDocument.remove(status.documentId(), jobId);
            log.info("[INDEXING] Cancelled queued job {}", jobId);
            return true;
        }
        CancellationScope startedMeanwhile = runningScopes.get(jobId);
        if (startedMeanwhile != null) {
            startedMeanwhile.cancel(reason);
            return true;
        }
        return false;
    }

    /**
     * Applies a transition unless the job already reached a terminal state, then publishes the result.
     */
    private Optional<IngestionJobStatus> transition(String jobId, UnaryOperator<IngestionJobStatus> change) {
        IngestionJobStatus[] before = new IngestionJobStatus[1];
        IngestionJobStatus after = statusesByJob.computeIfPresent(jobId, (id, current) -> {
            before[0] = current;
            return current.isTerminal() ? current : change.apply(current);
        });
        if (after != null && !after.equals(before[0])) {
            broadcaster.publish(after);
        }
        return Optional.ofNullable(after);
    }

    public Optional<IngestionJobStatus> getStatus(String jobId) {
        return Optional.ofNullable(statusesByJob.get(jobId));
    }

    /**
     * Returns the active job status for a document, else the most recently queued known status.
     */
    public Optional<IngestionJobStatus> getStatusForDocument(String documentId) {
        String activeJobId = jobIdsByDocument.get(documentId);
        if (activeJobId != null) {
            IngestionJobStatus active = statusesByJob.get(activeJobId);
            if (active != null) {
                return Optional.of(active);
            }
        }
        return statusesByJob.values().stream()
                .filter(status -> status.documentId().equals(documentId))
                .max(Comparator.comparing(IngestionJobStatus::queuedAt));
    }

    public List<IngestionJobStatus> allStatuses() {
        List<IngestionJobStatus> statuses = new ArrayList<>(statusesByJob.values());
        statuses.sort(Comparator.comparing(IngestionJobStatus::queuedAt));
        return statuses;
    }

    public boolean isDocumentQueuedOrRunning(String documentId) {
        String jobId = jobIdsByDocument.get(documentId);
        if (jobId == null) {
            return false;
        }
        IngestionJobStatus status = statusesByJob.get(jobId);
        return status != null && !status.isTerminal();
    }

    /**
     * Whether {@code jobId} is still the job registered for the document. A job that was superseded, or
     * whose successor already finished, no longer owns the document's index data.
     */
    public boolean isCurrentJob(String documentId, String jobId) {
        return jobId.equals(jobIdsByDocument.get(documentId));
    }

    /**
     * Aggregates the statuses of every known job stamped with {@code batchId}.
     *
     * @return empty when no job of the batch is known, including after its statuses were cleaned up
     */
    public Optional<IngestionBatchStatus> getBatchStatus(String batchId) {
        Set<String> members = jobIdsByBatch.get(batchId);
        if (members == null) {
            return Optional.empty();
        }
        List<IngestionJobStatus> statuses = new ArrayList<>();
        for (String jobId : members) {
            IngestionJobStatus status = statusesByJob.get(jobId);
            if (status != null) {
                statuses.add(status);
            }
        }
        if (statuses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(IngestionBatchStatus.of(batchId, statuses));
    }

    public int queueDepth() {
        return pending.size();
    }

    public int remainingCapacity() {
        return pending.remainingCapacity();
    }

    /**
     * Removes terminal statuses that completed longer than {@code maxAge} ago.
     *
     * @return number of statuses removed
     */
    public int cleanupOldStatuses(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, IngestionJobStatus> entry : statusesByJob.entrySet()) {
            IngestionJobStatus status = entry.getValue();
            if (status.isTerminal()
                    && status.completedAt() != null
                    && status.completedAt().isBefore(cutoff)
                    && statusesByJob.remove(entry.getKey(), status)) {
                removed++;
            }
        }
        if (removed > 0) {
            jobIdsByBatch.values().forEach(members -> members.removeIf(jobId -> !statusesByJob.containsKey(jobId)));
            jobIdsByBatch.values().removeIf(Set::isEmpty);
            log.debug("[INDEXING] Removed {} finished job statuses", removed);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${app.ingestion.status-cleanup-interval:PT5M}")
    public void cleanupExpiredStatuses() {
        cleanupOldStatuses(statusRetention);
    }
}
