package com.williamcallahan.knowledgeindex.service.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Batches embedding requests while preserving input ordering guarantees.
 *
 * <p>Up to {@code parallelBatches} requests are in flight at once. Failures are re-wrapped with the
 * batch range so callers can tell which texts could not be embedded.</p>
 */
public final class EmbeddingBatchEmbedder {

    private EmbeddingBatchEmbedder() {}

    public static List<float[]> embedAll(
            EmbeddingClient embeddingClient,
            List<String> texts,
            int batchSize,
            int parallelBatches,
            Executor executor) {
        Objects.requireNonNull(embeddingClient, "embeddingClient");
        Objects.requireNonNull(texts, "texts");
        Objects.requireNonNull(executor, "executor");
        if (texts.isEmpty()) {
            return List.of();
        }
        int effectiveBatchSize = Math.max(1, batchSize);
        int effectiveParallelism = Math.max(1, parallelBatches);

        List<BatchRange> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += effectiveBatchSize) {
            batches.add(new BatchRange(start, Math.min(start + effectiveBatchSize, texts.size())));
        }

        List<float[]> allEmbeddings = new ArrayList<>(texts.size());
        if (batches.size() == 1 || effectiveParallelism == 1) {
            for (BatchRange batch : batches) {
                allEmbeddings.addAll(embedSingleBatch(embeddingClient, texts, batch));
            }
            return List.copyOf(allEmbeddings);
        }

        for (int waveStart = 0; waveStart < batches.size(); waveStart += effectiveParallelism) {
            List<BatchRange> wave = batches.subList(waveStart, Math.min(waveStart + effectiveParallelism, batches.size()));
            List<CompletableFuture<List<float[]>>> futures = new ArrayList<>(wave.size());
            for (BatchRange batch : wave) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> embedSingleBatch(embeddingClient, texts, batch), executor));
            }
            for (CompletableFuture<List<float[]>> future : futures) {
                allEmbeddings.addAll(awaitBatch(future, futures));
            }
        }
        return List.copyOf(allEmbeddings);
    }

    private static List<float[]> awaitBatch(
            CompletableFuture<List<float[]>> future, List<CompletableFuture<List<float[]>>> wave) {
        try {
            return future.get();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            wave.forEach(pending -> pending.cancel(true));
            throw new EmbeddingServiceUnavailableException("Embedding interrupted", interrupted);
        } catch (ExecutionException executionException) {
            wave.forEach(pending -> pending.cancel(true));
            Throwable cause = executionException.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new EmbeddingServiceUnavailableException("Embedding batch failed", cause);
        }
    }

    private static List<float[]> embedSingleBatch(EmbeddingClient embeddingClient, List<String> texts, BatchRange batch) {
        List<String> textBatch = texts.subList(batch.start(), batch.end()).stream()
                .map(text -> text == null ? "" : text)
                .toList();

        List<float[]> batchEmbeddings;
        try {
            batchEmbeddings = embeddingClient.embed(textBatch);
        } catch (EmbeddingServiceUnavailableException embeddingFailure) {
            throw new EmbeddingServiceUnavailableException(
                    "Embedding failed for batch [" + batch.start() + ".." + (batch.end() - 1) + "]: "
                            + embeddingFailure.getMessage(),
                    embeddingFailure);
        }

        if (batchEmbeddings.size() != textBatch.size()) {
            throw new EmbeddingServiceUnavailableException("Embedding response count mismatch: expected "
                    + textBatch.size() + " but received " + batchEmbeddings.size()
                    + " for batch [" + batch.start() + ".." + (batch.end() - 1) + "]");
        }
        return batchEmbeddings;
    }

    private record BatchRange(int start, int end) {}
}
