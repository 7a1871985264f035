package com.williamcallahan.knowledgeindex.store;

import java.util.Objects;

/**
 * A vector index candidate with its native cosine distance (0 means identical direction).
 *
 * @param chunkId matched chunk
 * @param documentId owning document
 * @param distance cosine distance to the query vector
 */
public record VectorMatch(String chunkId, String documentId, double distance) {
    public VectorMatch {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(documentId, "documentId");
    }
}
