package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.VectorEntry;
import java.util.List;

/**
 * Similarity search port over chunk embeddings.
 */
public interface VectorIndex {

    /**
     * Inserts or replaces entries keyed by chunk id.
     */
    void upsert(List<VectorEntry> entries);

    /**
     * Returns up to {@code topK} matches within the filter, closest first.
     */
    List<VectorMatch> search(float[] queryVector, int topK, SearchFilter filter);

    void deleteByDocumentId(String documentId);

    long countByDocumentId(String documentId);
}
