package com.williamcallahan.knowledgeindex.domain.ingestion;

import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied options captured with a job when it is enqueued.
 *
 * @param scopeId scope the document belongs to
 * @param chunkingStrategy strategy override, empty for the configured default
 * @param metadata extra metadata merged into the document
 */
public record IngestionOptions(String scopeId, String chunkingStrategy, Map<String, String> metadata) {

    public IngestionOptions {
        Objects.requireNonNull(scopeId, "scopeId");
        chunkingStrategy = chunkingStrategy == null ? "" : chunkingStrategy;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static IngestionOptions forScope(String scopeId) {
        return new IngestionOptions(scopeId, "", Map.of());
    }
}
