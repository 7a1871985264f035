package com.williamcallahan.knowledgeindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionOptions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class IngestionProgressBroadcasterTest {

    private static final int BACKLOG = 4;

    private final CountDownLatch listenerEntered = new CountDownLatch(1);
    private final CountDownLatch releaseListener = new CountDownLatch(1);
    private final List<String> delivered = new CopyOnWriteArrayList<>();
    private IngestionProgressBroadcaster broadcaster;

    @AfterEach
    void tearDown() {
        releaseListener.countDown();
        if (broadcaster != null) {
            broadcaster.shutdown();
        }
    }

    @Test
    void blockedListenerCannotGrowBacklogPastBound() throws InterruptedException {
        IngestionProgressListener blocking = status -> {
            listenerEntered.countDown();
            try {
                releaseListener.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
            delivered.add(status.jobId());
        };
        broadcaster = new IngestionProgressBroadcaster(List.of(blocking), BACKLOG);

        List<IngestionJobStatus> statuses = new ArrayList<>();
        for (int index = 0; index < BACKLOG + 11; index++) {
            statuses.add(status("doc-" + index));
        }
        broadcaster.publish(statuses.get(0));
        assertTrue(listenerEntered.await(5, TimeUnit.SECONDS));

        for (IngestionJobStatus status : statuses.subList(1, statuses.size())) {
            broadcaster.publish(status);
        }

        assertEquals(BACKLOG, broadcaster.pendingUpdates());
        assertEquals(10, broadcaster.droppedUpdates());

        releaseListener.countDown();
        String newest = statuses.get(statuses.size() - 1).jobId();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!delivered.contains(newest) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(BACKLOG + 1, delivered.size());
        assertEquals(statuses.get(0).jobId(), delivered.get(0));
        assertEquals(newest, delivered.get(delivered.size() - 1));
    }

    @Test
    void failingListenerDoesNotStopOthers() throws InterruptedException {
        CountDownLatch received = new CountDownLatch(1);
        IngestionProgressListener failing = status -> {
            throw new IllegalStateException("listener down");
        };
        broadcaster = new IngestionProgressBroadcaster(List.of(failing, status -> received.countDown()), BACKLOG);

        broadcaster.publish(status("doc-1"));

        assertTrue(received.await(5, TimeUnit.SECONDS));
    }

    private static IngestionJobStatus status(String documentId) {
        IngestionJob job = IngestionJob.create(documentId, documentId + ".txt", IngestionOptions.forScope("team"), "");
        return IngestionJobStatus.queued(job, Instant.now());
    }
}
