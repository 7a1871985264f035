package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Document rows held in a concurrent map; id uniqueness behaves like a primary key constraint.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentMap<String, KnowledgeDocument> documentsById = new ConcurrentHashMap<>();

    @Override
    public Optional<KnowledgeDocument> findById(String documentId) {
        return Optional.ofNullable(documentsById.get(documentId));
    }

    @Override
    public Optional<KnowledgeDocument> findByScopeAndPath(String scopeId, String path) {
        return documentsById.values().stream()
                .filter(document -> document.scopeId().equals(scopeId) && document.path().equals(path))
                .min(Comparator.comparing(KnowledgeDocument::createdAt));
    }

    @Override
    public void insert(KnowledgeDocument document) {
        Objects.requireNonNull(document, "document");
        KnowledgeDocument existing = documentsById.putIfAbsent(document.id(), document);
        if (existing != null) {
            throw new IllegalStateException("Duplicate document id: " + document.id());
        }
    }

    @Override
    public void update(KnowledgeDocument document) {
        Objects.requireNonNull(document, "document");
        KnowledgeDocument replaced = documentsById.computeIfPresent(document.id(), (id, current) -> document);
        if (replaced == null) {
            throw new DocumentNotFoundException(document.id());
        }
    }

    @Override
    public boolean delete(String documentId) {
        return documentsById.remove(documentId) != null;
    }

    @Override
    public List<KnowledgeDocument> listByScope(String scopeId, String pathPrefix) {
        String prefix = pathPrefix == null ? "" : pathPrefix;
        return documentsById.values().stream()
                .filter(document -> document.scopeId().equals(scopeId) && document.path().startsWith(prefix))
                .sorted(Comparator.comparing(KnowledgeDocument::path))
                .toList();
    }

    @Override
    public List<KnowledgeDocument> listAll() {
        return documentsById.values().stream()
                .sorted(Comparator.comparing(KnowledgeDocument::scopeId).thenComparing(KnowledgeDocument::path))
                .toList();
    }
}
