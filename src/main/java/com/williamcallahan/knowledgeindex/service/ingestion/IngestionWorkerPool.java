package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobState;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed pool of workers draining the {@link IngestionQueue} through the {@link IngestionPipeline}.
 *
 * <p>Every job runs under its own child of a root {@link CancellationScope}; shutdown cancels the root so
 * in-flight jobs stop at their next phase boundary.</p>
 */
@Component
public class IngestionWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(IngestionWorkerPool.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final IngestionQueue queue;
    private final IngestionPipeline pipeline;
    private final IngestionProgressBroadcaster broadcaster;
    private final int workerCount;
    private final Duration shutdownGrace;
    private final Duration progressInterval;
    private final CancellationScope rootScope = CancellationScope.root();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ExecutorService workers;
    private ScheduledExecutorService heartbeat;

    public IngestionWorkerPool(
            IngestionQueue queue,
            IngestionPipeline pipeline,
            IngestionProgressBroadcaster broadcaster,
            AppProperties appProperties) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        AppProperties.Ingestion ingestion = appProperties.getIngestion();
        this.workerCount = Math.max(1, ingestion.getWorkerCount());
        this.shutdownGrace = ingestion.getShutdownGrace();
        this.progressInterval = ingestion.getProgressInterval();
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger threadNumber = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "ingestion-worker-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int index = 0; index < workerCount; index++) {
            workers.execute(this::workerLoop);
        }
        heartbeat = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ingestion-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = Math.max(100, progressInterval.toMillis());
        heartbeat.scheduleAtFixedRate(this::publishRunningStatuses, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[INDEXING] Started {} ingestion workers", workerCount);
    }

    private void workerLoop() {
        while (running.get() && !rootScope.isCancelled()) {
            Optional<IngestionJob> next;
            try {
                next = queue.poll(POLL_TIMEOUT);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                break;
            }
            next.ifPresent(this::runJob);
        }
    }

    void runJob(IngestionJob job) {
        CancellationScope jobScope = rootScope.child();
        if (!queue.markStarted(job, jobScope)) {
            return;
        }
        try {
            IngestionResult result = pipeline.process(
                    job,
                    jobScope,
                    phase -> queue.updatePhase(job.jobId(), phase),
                    () -> queue.isCurrentJob(job.documentId(), job.jobId()));
            if (result.success()) {
                queue.markCompleted(job);
            } else {
                queue.markFailed(job, result.errorMessage());
            }
        } catch (IngestionCancelledException cancelled) {
            queue.markCancelled(job, cancelled.getMessage());
        } catch (RuntimeException unexpected) {
            log.error("[INDEXING] Worker failed on job {}", job.jobId(), unexpected);
            queue.markFailed(job, unexpected.getMessage());
        }
    }

    private void publishRunningStatuses() {
        for (IngestionJobStatus status : queue.allStatuses()) {
            if (status.state() == IngestionJobState.PROCESSING) {
                broadcaster.publish(status);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        rootScope.cancel("Shutting down");
        heartbeat.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[INDEXING] Workers still running after {} ms, forcing shutdown", shutdownGrace.toMillis());
                workers.shutdownNow();
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("[INDEXING] Ingestion workers stopped");
    }
}
