package com.williamcallahan.knowledgeindex.domain.reindex;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of one reindex batch.
 *
 * @param batchId batch identifier carried by every enqueued job
 * @param totalDocuments number of documents evaluated
 * @param enqueuedCount documents queued for reprocessing
 * @param skippedCount documents left alone
 * @param failedCount documents that could not be evaluated or queued
 * @param reasonCounts histogram of reasons
 * @param documents per-document entries
 */
public record ReindexResult(
        String batchId,
        int totalDocuments,
        int enqueuedCount,
        int skippedCount,
        int failedCount,
        Map<ReindexReason, Integer> reasonCounts,
        List<ReindexDocumentResult> documents) {

    public ReindexResult {
        Objects.requireNonNull(batchId, "batchId");
        reasonCounts = reasonCounts == null || reasonCounts.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(reasonCounts));
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    public static ReindexResult summarize(String batchId, List<ReindexDocumentResult> documents) {
        Map<ReindexReason, Integer> reasonCounts = new EnumMap<>(ReindexReason.class);
        int enqueued = 0;
        int skipped = 0;
        int failed = 0;
        for (ReindexDocumentResult documentResult : documents) {
            reasonCounts.merge(documentResult.reason(), 1, Integer::sum);
            switch (documentResult.action()) {
                case ENQUEUED -> enqueued++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new ReindexResult(batchId, documents.size(), enqueued, skipped, failed, reasonCounts, documents);
    }

    public int countFor(ReindexReason reason) {
        return reasonCounts.getOrDefault(reason, 0);
    }
}
