package com.williamcallahan.knowledgeindex.domain.ingestion;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Progress of every job stamped with one batch id, as produced by a reindex run.
 *
 * @param batchId batch identifier
 * @param totalJobs jobs of the batch whose status is still retained
 * @param stateCounts number of jobs per state, every state present
 * @param percentComplete mean progress over the batch, finished jobs counting as 100
 * @param finished true once every job reached a terminal state
 */
public record IngestionBatchStatus(
        String batchId,
        int totalJobs,
        Map<IngestionJobState, Integer> stateCounts,
        int percentComplete,
        boolean finished) {

    public IngestionBatchStatus {
        Objects.requireNonNull(batchId, "batchId");
        stateCounts = Map.copyOf(stateCounts);
    }

    public static IngestionBatchStatus of(String batchId, List<IngestionJobStatus> statuses) {
        Map<IngestionJobState, Integer> counts = new EnumMap<>(IngestionJobState.class);
        for (IngestionJobState state : IngestionJobState.values()) {
            counts.put(state, 0);
        }
        long progressSum = 0;
        boolean finished = true;
        for (IngestionJobStatus status : statuses) {
            counts.merge(status.state(), 1, Integer::sum);
            progressSum += status.isTerminal() ? 100 : status.percentComplete();
            finished &= status.isTerminal();
        }
        int percent = statuses.isEmpty() ? 0 : (int) (progressSum / statuses.size());
        return new IngestionBatchStatus(batchId, statuses.size(), counts, percent, finished);
    }

    public int count(IngestionJobState state) {
        return stateCounts.getOrDefault(state, 0);
    }
}
