package com.williamcallahan.knowledgeindex.config;

import java.util.Objects;

/**
 * Immutable chunking configuration captured when an ingestion run starts.
 *
 * @param strategy chunking strategy name (FixedSize, Recursive, Semantic)
 * @param maxChunkSize maximum chunk size in estimated tokens
 * @param overlap overlap between consecutive chunks in estimated tokens
 * @param minChunkSize minimum chunk size in estimated tokens
 * @param semanticThreshold cosine similarity below which the semantic strategy opens a new chunk
 */
public record ChunkingSettings(
        String strategy, int maxChunkSize, int overlap, int minChunkSize, double semanticThreshold) {

    public ChunkingSettings {
        Objects.requireNonNull(strategy, "strategy");
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap cannot be negative");
        }
        if (minChunkSize < 0) {
            throw new IllegalArgumentException("minChunkSize cannot be negative");
        }
    }

    public static ChunkingSettings from(AppProperties appProperties) {
        AppProperties.Chunking chunking = appProperties.getChunking();
        return new ChunkingSettings(
                chunking.getStrategy(),
                chunking.getMaxChunkSize(),
                chunking.getOverlap(),
                chunking.getMinChunkSize(),
                chunking.getSemanticThreshold());
    }

    /**
     * Returns a copy using the given strategy, or this instance when the override is blank.
     */
    public ChunkingSettings withStrategy(String strategyOverride) {
        if (strategyOverride == null || strategyOverride.isBlank()) {
            return this;
        }
        return new ChunkingSettings(strategyOverride, maxChunkSize, overlap, minChunkSize, semanticThreshold);
    }

    /**
     * Key compared against the values recorded in document metadata to detect chunking drift.
     */
    public String settingsKey() {
        return strategy + ":" + maxChunkSize + ":" + overlap;
    }
}
