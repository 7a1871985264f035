package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.DocumentChunk;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for chunk rows.
 */
public interface ChunkStore {

    void saveAll(List<DocumentChunk> chunks);

    Optional<DocumentChunk> findById(String chunkId);

    /**
     * Returns the document's chunks ordered by chunk index.
     */
    List<DocumentChunk> findByDocumentId(String documentId);

    /**
     * Removes every chunk of the document.
     *
     * @return number of chunks removed
     */
    int deleteByDocumentId(String documentId);

    int countByDocumentId(String documentId);
}
