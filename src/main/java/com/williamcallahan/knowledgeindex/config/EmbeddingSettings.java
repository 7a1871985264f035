package com.williamcallahan.knowledgeindex.config;

import java.util.Objects;

/**
 * Immutable embedding configuration captured when an ingestion run starts.
 *
 * @param provider embedding provider identifier
 * @param model embedding model identifier
 * @param dimensions expected vector dimensionality
 * @param batchSize number of texts per embedding request
 * @param parallelBatches maximum number of batch requests in flight for one document
 */
public record EmbeddingSettings(String provider, String model, int dimensions, int batchSize, int parallelBatches) {

    public EmbeddingSettings {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        batchSize = Math.max(1, batchSize);
        parallelBatches = Math.max(1, parallelBatches);
    }

    public static EmbeddingSettings from(AppProperties appProperties) {
        AppProperties.Embedding embedding = appProperties.getEmbedding();
        return new EmbeddingSettings(
                embedding.getProvider(),
                embedding.getModel(),
                embedding.getDimensions(),
                embedding.getBatchSize(),
                embedding.getParallelBatches());
    }

    /**
     * Key compared against the values recorded in document metadata to detect embedding drift.
     */
    public String settingsKey() {
        return provider + ":" + model + ":" + dimensions;
    }
}
