package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.store.ChunkStore;
import com.williamcallahan.knowledgeindex.store.ContentStore;
import com.williamcallahan.knowledgeindex.store.DocumentStore;
import com.williamcallahan.knowledgeindex.store.KeywordIndex;
import com.williamcallahan.knowledgeindex.store.VectorIndex;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Groups the stores an indexing run reads from and writes to.
 *
 * <p>Bundles document rows, chunk rows, the vector and keyword indexes and the original content so
 * the pipeline, the reindex service and the upload service accept a single cohesive dependency.</p>
 *
 * @param documents document rows
 * @param chunks chunk rows
 * @param vectors dense vector index
 * @param keywords lexical index
 * @param content original document bytes
 */
@Service
public record IngestionStorageServices(
        DocumentStore documents, ChunkStore chunks, VectorIndex vectors, KeywordIndex keywords, ContentStore content) {

    public IngestionStorageServices {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(vectors, "vectors");
        Objects.requireNonNull(keywords, "keywords");
        Objects.requireNonNull(content, "content");
    }

    /**
     * Removes every chunk, vector and keyword entry of a document.
     *
     * @return number of chunk rows removed
     */
    public int removeIndexData(String documentId) {
        int removedChunks = chunks.deleteByDocumentId(documentId);
        vectors.deleteByDocumentId(documentId);
        keywords.deleteByDocumentId(documentId);
        return removedChunks;
    }
}
