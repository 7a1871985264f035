package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.VectorEntry;
import com.williamcallahan.knowledgeindex.service.embedding.VectorMath;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory vector index used when Qdrant is not enabled.
 * Brute-force cosine distance over every entry in the requested scope.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final int dimensions;
    private final ConcurrentHashMap<String, VectorEntry> entriesByChunkId = new ConcurrentHashMap<>();

    public InMemoryVectorIndex(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        log.info("Using in-memory vector index (dimensions={})", dimensions);
    }

    @Override
    public void upsert(List<VectorEntry> entries) {
        for (VectorEntry entry : entries) {
            if (entry.vector().length != dimensions) {
                throw new IllegalArgumentException("Vector dimension mismatch for chunk " + entry.chunkId()
                        + ": expected " + dimensions + " but received " + entry.vector().length);
            }
        }
        for (VectorEntry entry : entries) {
            entriesByChunkId.put(entry.chunkId(), entry);
        }
        log.debug("Upserted {} vectors (total={})", entries.size(), entriesByChunkId.size());
    }

    @Override
    public List<VectorMatch> search(float[] queryVector, int topK, SearchFilter filter) {
        if (topK <= 0 || entriesByChunkId.isEmpty()) {
            return List.of();
        }
        if (queryVector.length != dimensions) {
            throw new IllegalArgumentException(
                    "Query vector dimension mismatch: expected " + dimensions + " but received " + queryVector.length);
        }
        return entriesByChunkId.values().stream()
                .filter(entry -> filter.matches(entry.scopeId(), entry.path()))
                .map(entry -> new VectorMatch(
                        entry.chunkId(),
                        entry.documentId(),
                        1.0 - VectorMath.cosineSimilarity(queryVector, entry.vector())))
                .sorted(Comparator.comparingDouble(VectorMatch::distance).thenComparing(VectorMatch::chunkId))
                .limit(topK)
                .toList();
    }

    @Override
    public void deleteByDocumentId(String documentId) {
        entriesByChunkId.values().removeIf(entry -> entry.documentId().equals(documentId));
    }

    @Override
    public long countByDocumentId(String documentId) {
        return entriesByChunkId.values().stream()
                .filter(entry -> entry.documentId().equals(documentId))
                .count();
    }

    public int size() {
        return entriesByChunkId.size();
    }
}
