package com.williamcallahan.knowledgeindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.domain.ingestion.EnqueueResult;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionBatchStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobState;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionOptions;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionPhase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IngestionQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
    private final List<IngestionJobStatus> published = new ArrayList<>();
    private IngestionQueue queue;

    @BeforeEach
    void setUp() {
        IngestionProgressBroadcaster broadcaster =
                new IngestionProgressBroadcaster(List.<IngestionProgressListener>of(published::add), new DirectExecutorService());
        queue = new IngestionQueue(2, Duration.ofHours(1), broadcaster, clock);
    }

    @Test
    void fullQueueRejectsWithoutRecordingStatus() {
        assertEquals(EnqueueResult.ACCEPTED, queue.tryEnqueue(job("doc-1")));
        assertEquals(EnqueueResult.ACCEPTED, queue.tryEnqueue(job("doc-2")));
        IngestionJob overflow = job("doc-3");

        long started = System.nanoTime();
        EnqueueResult result = queue.enqueue(overflow, Duration.ofMillis(20));
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(EnqueueResult.QUEUE_FULL, result);
        assertTrue(waitedMillis < 2_000, "enqueue waited " + waitedMillis + " ms");
        assertTrue(queue.getStatus(overflow.jobId()).isEmpty());
        assertFalse(queue.isDocumentQueuedOrRunning("doc-3"));
        assertEquals(2, queue.queueDepth());
    }

    @Test
    void jobsAreDeliveredInArrivalOrder() throws InterruptedException {
        IngestionJob first = job("doc-1");
        IngestionJob second = job("doc-2");
        queue.tryEnqueue(first);
        queue.tryEnqueue(second);

        assertEquals(first.jobId(), queue.poll(Duration.ZERO).orElseThrow().jobId());
        assertEquals(second.jobId(), queue.poll(Duration.ZERO).orElseThrow().jobId());
        assertTrue(queue.poll(Duration.ZERO).isEmpty());
    }

    @Test
    void cancelledQueuedJobIsSkipped() throws InterruptedException {
        IngestionJob cancelled = job("doc-1");
        IngestionJob kept = job("doc-2");
        queue.tryEnqueue(cancelled);
        queue.tryEnqueue(kept);

        assertTrue(queue.cancelJobForDocument("doc-1"));

        Optional<IngestionJob> next = queue.poll(Duration.ZERO);
        assertEquals(kept.jobId(), next.orElseThrow().jobId());
        IngestionJobStatus status = queue.getStatus(cancelled.jobId()).orElseThrow();
        assertEquals(IngestionJobState.CANCELLED, status.state());
        assertEquals("Cancelled by request", status.errorMessage());
    }

    @Test
    void newerJobForSameDocumentSupersedesQueuedOne() {
        IngestionJob older = job("doc-1");
        IngestionJob newer = job("doc-1");
        queue.tryEnqueue(older);
        queue.tryEnqueue(newer);

        IngestionJobStatus olderStatus = queue.getStatus(older.jobId()).orElseThrow();
        assertEquals(IngestionJobState.CANCELLED, olderStatus.state());
        assertEquals("Superseded by job " + newer.jobId(), olderStatus.errorMessage());
        assertEquals(newer.jobId(), queue.getStatusForDocument("doc-1").orElseThrow().jobId());
    }

    @Test
    void cancellingRunningJobSignalsItsScope() throws InterruptedException {
        IngestionJob running = job("doc-1");
        queue.tryEnqueue(running);
        IngestionJob polled = queue.poll(Duration.ZERO).orElseThrow();
        CancellationScope scope = CancellationScope.root().child();
        assertTrue(queue.markStarted(polled, scope));

        assertTrue(queue.cancelJobForDocument("doc-1"));

        assertTrue(scope.isCancelled());
        assertEquals("Cancelled by request", scope.reason());
        assertEquals(IngestionJobState.PROCESSING, queue.getStatus(running.jobId()).orElseThrow().state());
    }

    @Test
    void jobCancelledBeforeStartDoesNotRun() {
        IngestionJob job = job("doc-1");
        queue.tryEnqueue(job);
        queue.cancelJob(job.jobId(), "Cancelled by request");

        assertFalse(queue.markStarted(job, CancellationScope.root()));
    }

    @Test
    void terminalStatusIsNeverOverwritten() throws InterruptedException {
        IngestionJob job = job("doc-1");
        queue.tryEnqueue(job);
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.markCompleted(job);

        queue.markFailed(job, "late failure");
        queue.updatePhase(job.jobId(), IngestionPhase.EMBEDDING);

        IngestionJobStatus status = queue.getStatus(job.jobId()).orElseThrow();
        assertEquals(IngestionJobState.COMPLETED, status.state());
        assertEquals(100, status.percentComplete());
        assertFalse(queue.cancelJobForDocument("doc-1"));
    }

    @Test
    void progressUpdatesArePublished() throws InterruptedException {
        IngestionJob job = job("doc-1");
        queue.tryEnqueue(job);
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.updatePhase(job.jobId(), IngestionPhase.EMBEDDING);
        queue.markCompleted(job);

        List<IngestionJobState> states = published.stream().map(IngestionJobStatus::state).toList();
        assertEquals(IngestionJobState.QUEUED, states.get(0));
        assertEquals(IngestionJobState.COMPLETED, states.get(states.size() - 1));
        assertTrue(published.stream().anyMatch(status -> status.phase() == IngestionPhase.EMBEDDING));
    }

    @Test
    void cleanupRemovesOnlyOldTerminalStatuses() throws InterruptedException {
        IngestionJob finished = job("doc-1");
        IngestionJob waiting = job("doc-2");
        queue.tryEnqueue(finished);
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.markFailed(finished, "boom");
        queue.tryEnqueue(waiting);

        assertEquals(0, queue.cleanupOldStatuses(Duration.ofMinutes(30)));

        clock.advance(Duration.ofHours(2));
        assertEquals(1, queue.cleanupOldStatuses(Duration.ofMinutes(30)));
        assertTrue(queue.getStatus(finished.jobId()).isEmpty());
        assertTrue(queue.getStatus(waiting.jobId()).isPresent());
    }

    @Test
    void rejectedJobLeavesRunningJobRegisteredForItsDocument() throws InterruptedException {
        IngestionJob running = job("doc-1");
        queue.tryEnqueue(running);
        CancellationScope scope = CancellationScope.root().child();
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), scope);
        queue.tryEnqueue(job("doc-2"));
        queue.tryEnqueue(job("doc-3"));

        IngestionJob rejected = job("doc-1");
        assertEquals(EnqueueResult.QUEUE_FULL, queue.tryEnqueue(rejected));

        assertTrue(queue.isCurrentJob("doc-1", running.jobId()));
        assertFalse(queue.isCurrentJob("doc-1", rejected.jobId()));
        assertFalse(scope.isCancelled());
        queue.markCompleted(running);
        assertFalse(queue.isDocumentQueuedOrRunning("doc-1"));
    }

    @Test
    void jobFinishedRightAfterOfferReleasesItsDocument() throws InterruptedException {
        IngestionJob job = job("doc-1");
        queue.tryEnqueue(job);
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.markCompleted(job);

        assertFalse(queue.isCurrentJob("doc-1", job.jobId()));
        assertFalse(queue.cancelJobForDocument("doc-1"));
    }

    @Test
    void supersededJobIsNoLongerCurrent() throws InterruptedException {
        IngestionJob older = job("doc-1");
        queue.tryEnqueue(older);
        CancellationScope scope = CancellationScope.root().child();
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), scope);

        IngestionJob newer = job("doc-1");
        queue.tryEnqueue(newer);

        assertTrue(scope.isCancelled());
        assertFalse(queue.isCurrentJob("doc-1", older.jobId()));
        assertTrue(queue.isCurrentJob("doc-1", newer.jobId()));
    }

    @Test
    void batchStatusAggregatesItsJobs() throws InterruptedException {
        IngestionJob first = batchJob("doc-1", "batch-1");
        IngestionJob second = batchJob("doc-2", "batch-1");
        queue.tryEnqueue(first);
        queue.tryEnqueue(second);
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.markCompleted(first);

        IngestionBatchStatus batch = queue.getBatchStatus("batch-1").orElseThrow();

        assertEquals(2, batch.totalJobs());
        assertEquals(1, batch.count(IngestionJobState.COMPLETED));
        assertEquals(1, batch.count(IngestionJobState.QUEUED));
        assertEquals(0, batch.count(IngestionJobState.FAILED));
        assertEquals(50, batch.percentComplete());
        assertFalse(batch.finished());

        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.markFailed(second, "boom");
        IngestionBatchStatus done = queue.getBatchStatus("batch-1").orElseThrow();
        assertTrue(done.finished());
        assertEquals(100, done.percentComplete());
        assertTrue(queue.getBatchStatus("other").isEmpty());
    }

    @Test
    void batchStatusIsForgottenWithItsJobs() throws InterruptedException {
        IngestionJob job = batchJob("doc-1", "batch-1");
        queue.tryEnqueue(job);
        queue.markStarted(queue.poll(Duration.ZERO).orElseThrow(), CancellationScope.root());
        queue.markCompleted(job);

        clock.advance(Duration.ofHours(2));
        queue.cleanupOldStatuses(Duration.ofMinutes(30));

        assertTrue(queue.getBatchStatus("batch-1").isEmpty());
    }

    @Test
    void rejectedBatchJobIsNotCounted() {
        queue.tryEnqueue(job("doc-1"));
        queue.tryEnqueue(job("doc-2"));

        assertEquals(EnqueueResult.QUEUE_FULL, queue.tryEnqueue(batchJob("doc-3", "batch-1")));

        assertTrue(queue.getBatchStatus("batch-1").isEmpty());
    }

    private static IngestionJob batchJob(String documentId, String batchId) {
        return IngestionJob.create(documentId, documentId + ".txt", IngestionOptions.forScope("team"), batchId);
    }

    private static IngestionJob job(String documentId) {
        return IngestionJob.create(documentId, documentId + ".txt", IngestionOptions.forScope("team"), "");
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration amount) {
            now = now.plus(amount);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    /**
     * Runs broadcast tasks on the calling thread so published statuses are visible immediately.
     */
    static final class DirectExecutorService extends AbstractExecutorService {
        private volatile boolean shutdown;

        @Override
        public void execute(Runnable command) {
            command.run();
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
