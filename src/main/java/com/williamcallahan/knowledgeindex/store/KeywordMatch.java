package com.williamcallahan.knowledgeindex.store;

import java.util.Objects;

/**
 * A lexical index candidate with its raw, unnormalized relevance score.
 *
 * @param chunkId matched chunk
 * @param documentId owning document
 * @param content chunk text
 * @param rawScore engine-native relevance score
 */
public record KeywordMatch(String chunkId, String documentId, String content, double rawScore) {
    public KeywordMatch {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(documentId, "documentId");
        content = content == null ? "" : content;
    }
}
