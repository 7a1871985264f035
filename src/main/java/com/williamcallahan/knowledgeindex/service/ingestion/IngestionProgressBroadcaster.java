package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Delivers status snapshots to every registered listener on a dedicated thread.
 *
 * <p>Publishing never blocks the caller and listener failures never reach it. Delivery is best effort:
 * at most {@link #DEFAULT_BACKLOG} updates wait for a slow listener, and the oldest waiting update is
 * dropped to make room for a new one.</p>
 */
@Component
public class IngestionProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(IngestionProgressBroadcaster.class);

    static final int DEFAULT_BACKLOG = 256;

    private final List<IngestionProgressListener> listeners;
    private final ExecutorService executor;
    private final AtomicLong droppedUpdates = new AtomicLong();

    @Autowired
    public IngestionProgressBroadcaster(List<IngestionProgressListener> listeners) {
        this(listeners, DEFAULT_BACKLOG);
    }

    IngestionProgressBroadcaster(List<IngestionProgressListener> listeners, int backlog) {
        this.listeners = List.copyOf(listeners);
        this.executor = boundedExecutor(backlog);
    }

    IngestionProgressBroadcaster(List<IngestionProgressListener> listeners, ExecutorService executor) {
        this.listeners = List.copyOf(listeners);
        this.executor = executor;
    }

    private ThreadPoolExecutor boundedExecutor(int backlog) {
        if (backlog <= 0) {
            throw new IllegalArgumentException("Progress backlog must be positive");
        }
        return new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(backlog),
                runnable -> {
                    Thread thread = new Thread(runnable, "ingestion-progress");
                    thread.setDaemon(true);
                    return thread;
                },
                new CountingDiscardOldestPolicy());
    }

    public void publish(IngestionJobStatus status) {
        if (status == null || listeners.isEmpty()) {
            return;
        }
        try {
            executor.execute(() -> deliver(status));
        } catch (RejectedExecutionException rejected) {
            log.debug("[INDEXING] Progress update for job {} dropped after shutdown", status.jobId());
        }
    }

    private void deliver(IngestionJobStatus status) {
        for (IngestionProgressListener listener : listeners) {
            try {
                listener.onProgress(status);
            } catch (RuntimeException listenerFailure) {
                log.warn(
                        "[INDEXING] Progress listener {} failed for job {}: {}",
                        listener.getClass().getSimpleName(),
                        status.jobId(),
                        listenerFailure.getMessage());
            }
        }
    }

    /**
     * Updates waiting for delivery.
     */
    int pendingUpdates() {
        return executor instanceof ThreadPoolExecutor pool ? pool.getQueue().size() : 0;
    }

    long droppedUpdates() {
        return droppedUpdates.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }

    private final class CountingDiscardOldestPolicy extends ThreadPoolExecutor.DiscardOldestPolicy {
        @Override
        public void rejectedExecution(Runnable runnable, ThreadPoolExecutor pool) {
            if (!pool.isShutdown()) {
                long dropped = droppedUpdates.incrementAndGet();
                if (dropped % DEFAULT_BACKLOG == 1) {
                    log.warn("[INDEXING] Progress listeners are falling behind, {} updates dropped so far", dropped);
                }
            }
            super.rejectedExecution(runnable, pool);
        }
    }
}
