package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.DocumentChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Chunk rows grouped by document in concurrent maps.
 */
public class InMemoryChunkStore implements ChunkStore {

    private final ConcurrentMap<String, DocumentChunk> chunksById = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> chunkIdsByDocument = new ConcurrentHashMap<>();

    @Override
    public void saveAll(List<DocumentChunk> chunks) {
        for (DocumentChunk chunk : chunks) {
            chunksById.put(chunk.id(), chunk);
            chunkIdsByDocument.compute(chunk.documentId(), (documentId, chunkIds) -> {
                List<String> updated = chunkIds == null ? new ArrayList<>() : new ArrayList<>(chunkIds);
                if (!updated.contains(chunk.id())) {
                    updated.add(chunk.id());
                }
                return List.copyOf(updated);
            });
        }
    }

    @Override
    public Optional<DocumentChunk> findById(String chunkId) {
        return Optional.ofNullable(chunksById.get(chunkId));
    }

    @Override
    public List<DocumentChunk> findByDocumentId(String documentId) {
        return chunkIdsByDocument.getOrDefault(documentId, List.of()).stream()
                .map(chunksById::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(DocumentChunk::chunkIndex))
                .toList();
    }

    @Override
    public int deleteByDocumentId(String documentId) {
        List<String> removedIds = chunkIdsByDocument.remove(documentId);
        if (removedIds == null) {
            return 0;
        }
        int removed = 0;
        for (String chunkId : removedIds) {
            if (chunksById.remove(chunkId) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int countByDocumentId(String documentId) {
        return chunkIdsByDocument.getOrDefault(documentId, List.of()).size();
    }
}
