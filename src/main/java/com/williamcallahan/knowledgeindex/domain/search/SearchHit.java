package com.williamcallahan.knowledgeindex.domain.search;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A scored chunk returned by retrieval or reranking.
 *
 * @param chunkId chunk identifier
 * @param documentId owning document
 * @param content chunk text
 * @param score relevance score in [0, 1]
 * @param metadata hit metadata; hybrid fan-out sets {@link #SOURCE_KEY}
 */
public record SearchHit(String chunkId, String documentId, String content, double score, Map<String, Object> metadata) {

    public static final String SOURCE_KEY = "source";
    public static final String SOURCE_VECTOR = "vector";
    public static final String SOURCE_KEYWORD = "keyword";

    public SearchHit {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(documentId, "documentId");
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String source() {
        Object source = metadata.get(SOURCE_KEY);
        return source == null ? "" : source.toString();
    }

    /**
     * Returns a copy with a new score and the given entries merged over the current metadata.
     */
    public SearchHit rescored(double newScore, Map<String, Object> additionalMetadata) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(additionalMetadata);
        return new SearchHit(chunkId, documentId, content, newScore, merged);
    }

    public SearchHit withSource(String source) {
        return rescored(score, Map.of(SOURCE_KEY, source));
    }
}
