package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for document rows.
 */
public interface DocumentStore {

    Optional<KnowledgeDocument> findById(String documentId);

    Optional<KnowledgeDocument> findByScopeAndPath(String scopeId, String path);

    /**
     * Inserts a new row.
     *
     * @throws IllegalStateException when a row with the same id already exists
     */
    void insert(KnowledgeDocument document);

    /**
     * Replaces an existing row.
     *
     * @throws DocumentNotFoundException when no row has the document's id
     */
    void update(KnowledgeDocument document);

    /**
     * Removes a row.
     *
     * @return true when a row was removed
     */
    boolean delete(String documentId);

    /**
     * Lists documents in a scope whose path starts with the prefix (empty prefix lists the whole scope).
     */
    List<KnowledgeDocument> listByScope(String scopeId, String pathPrefix);

    List<KnowledgeDocument> listAll();
}
