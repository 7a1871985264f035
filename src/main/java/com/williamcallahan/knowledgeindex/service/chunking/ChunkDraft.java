package com.williamcallahan.knowledgeindex.service.chunking;

import java.util.Map;

/**
 * A chunk produced by a strategy, before it is assigned ids and stored.
 *
 * @param content chunk text
 * @param index zero-based ordinal
 * @param tokenCount estimated tokens
 * @param startOffset inclusive character offset into the parsed text
 * @param endOffset exclusive character offset into the parsed text
 * @param metadata strategy metadata
 */
public record ChunkDraft(
        String content, int index, int tokenCount, int startOffset, int endOffset, Map<String, String> metadata) {

    public ChunkDraft {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid chunk offsets [" + startOffset + ", " + endOffset + ")");
        }
    }
}
