package com.williamcallahan.knowledgeindex.domain.document;

import java.util.Objects;

/**
 * Embedding of one chunk as written to the vector index.
 *
 * @param chunkId chunk the vector belongs to
 * @param documentId owning document
 * @param scopeId owning scope
 * @param path owning document's logical path
 * @param vector embedding values
 * @param modelId model that produced the embedding
 */
public record VectorEntry(
        String chunkId, String documentId, String scopeId, String path, float[] vector, String modelId) {

    public VectorEntry {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(scopeId, "scopeId");
        Objects.requireNonNull(vector, "vector");
        path = path == null ? "" : path;
        modelId = modelId == null ? "" : modelId;
    }
}
