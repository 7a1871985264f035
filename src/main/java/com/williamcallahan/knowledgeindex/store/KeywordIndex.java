package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.DocumentChunk;
import java.util.List;

/**
 * Lexical full-text search port over chunks.
 */
public interface KeywordIndex {

    /**
     * Indexes chunks, replacing any entry with the same chunk id.
     */
    void index(List<DocumentChunk> chunks);

    /**
     * Returns up to {@code topK} matches within the filter, most relevant first.
     */
    List<KeywordMatch> search(String query, int topK, SearchFilter filter);

    void deleteByDocumentId(String documentId);

    long countByDocumentId(String documentId);
}
