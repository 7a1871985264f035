package com.williamcallahan.knowledgeindex.domain.document;

import java.util.Map;
import java.util.Objects;

/**
 * A stored span of a document's parsed text; the unit of embedding and retrieval.
 *
 * @param id chunk identifier
 * @param documentId owning document
 * @param scopeId owning scope, denormalized for filtering
 * @param path owning document's logical path, denormalized for prefix filtering
 * @param content chunk text
 * @param chunkIndex zero-based ordinal within the document
 * @param tokenCount estimated token count
 * @param startOffset inclusive character offset into the parsed text
 * @param endOffset exclusive character offset into the parsed text
 * @param metadata chunk metadata
 */
public record DocumentChunk(
        String id,
        String documentId,
        String scopeId,
        String path,
        String content,
        int chunkIndex,
        int tokenCount,
        int startOffset,
        int endOffset,
        Map<String, String> metadata) {

    public DocumentChunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(scopeId, "scopeId");
        path = path == null ? "" : path;
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
