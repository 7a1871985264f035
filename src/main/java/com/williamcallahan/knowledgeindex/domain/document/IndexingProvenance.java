package com.williamcallahan.knowledgeindex.domain.document;

import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.config.EmbeddingSettings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the settings a document was indexed with, stored in the document's own metadata.
 */
public final class IndexingProvenance {

    public static final String CHUNKING_STRATEGY = "IndexedWith:ChunkingStrategy";
    public static final String CHUNKING_MAX_SIZE = "IndexedWith:ChunkingMaxSize";
    public static final String CHUNKING_OVERLAP = "IndexedWith:ChunkingOverlap";
    public static final String EMBEDDING_PROVIDER = "IndexedWith:EmbeddingProvider";
    public static final String EMBEDDING_MODEL = "IndexedWith:EmbeddingModel";
    public static final String EMBEDDING_DIMENSIONS = "IndexedWith:EmbeddingDimensions";

    private IndexingProvenance() {}

    public static Map<String, String> describe(ChunkingSettings chunking, EmbeddingSettings embedding) {
        Map<String, String> provenance = new LinkedHashMap<>();
        provenance.put(CHUNKING_STRATEGY, chunking.strategy());
        provenance.put(CHUNKING_MAX_SIZE, String.valueOf(chunking.maxChunkSize()));
        provenance.put(CHUNKING_OVERLAP, String.valueOf(chunking.overlap()));
        provenance.put(EMBEDDING_PROVIDER, embedding.provider());
        provenance.put(EMBEDDING_MODEL, embedding.model());
        provenance.put(EMBEDDING_DIMENSIONS, String.valueOf(embedding.dimensions()));
        return provenance;
    }

    /**
     * Returns the recorded chunking key, or empty when any part was never recorded.
     */
    public static Optional<String> recordedChunkingKey(Map<String, String> metadata) {
        return joinIfComplete(metadata, CHUNKING_STRATEGY, CHUNKING_MAX_SIZE, CHUNKING_OVERLAP);
    }

    /**
     * Returns the recorded embedding key, or empty when any part was never recorded.
     */
    public static Optional<String> recordedEmbeddingKey(Map<String, String> metadata) {
        return joinIfComplete(metadata, EMBEDDING_PROVIDER, EMBEDDING_MODEL, EMBEDDING_DIMENSIONS);
    }

    private static Optional<String> joinIfComplete(Map<String, String> metadata, String... keys) {
        if (metadata == null || metadata.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder joined = new StringBuilder();
        for (String key : keys) {
            String recordedValue = metadata.get(key);
            if (recordedValue == null || recordedValue.isBlank()) {
                return Optional.empty();
            }
            if (joined.length() > 0) {
                joined.append(':');
            }
            joined.append(recordedValue);
        }
        return Optional.of(joined.toString());
    }
}
