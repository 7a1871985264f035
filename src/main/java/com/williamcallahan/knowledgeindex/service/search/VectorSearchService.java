package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.domain.document.DocumentChunk;
import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingClient;
import com.williamcallahan.knowledgeindex.store.ChunkStore;
import com.williamcallahan.knowledgeindex.store.SearchFilter;
import com.williamcallahan.knowledgeindex.store.VectorIndex;
import com.williamcallahan.knowledgeindex.store.VectorMatch;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dense retrieval: embeds the query and converts vector distances into similarities.
 */
@Service
public class VectorSearchService {
    private static final Logger log = LoggerFactory.getLogger(VectorSearchService.class);

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final ChunkStore chunkStore;

    public VectorSearchService(EmbeddingClient embeddingClient, VectorIndex vectorIndex, ChunkStore chunkStore) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.chunkStore = Objects.requireNonNull(chunkStore, "chunkStore");
    }

    /**
     * Returns hits scored by {@code clamp(1 - distance, 0, 1)}, best first, dropping those below {@code minScore}.
     *
     * @param query query text
     * @param filter scope and path restriction
     * @param candidateLimit number of nearest neighbours requested from the index
     * @param minScore minimum similarity kept
     */
    public List<SearchHit> search(String query, SearchFilter filter, int candidateLimit, double minScore) {
        float[] queryVector = embeddingClient.embed(query);
        List<VectorMatch> matches = vectorIndex.search(queryVector, candidateLimit, filter);
        List<SearchHit> hits = new ArrayList<>(matches.size());
        for (VectorMatch match : matches) {
            double similarity = similarityOf(match.distance());
            if (similarity < minScore) {
                continue;
            }
            Optional<DocumentChunk> chunk = chunkStore.findById(match.chunkId());
            if (chunk.isEmpty()) {
                log.debug("[SEARCH] Vector match {} has no stored chunk, skipping", match.chunkId());
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(SearchHit.SOURCE_KEY, SearchHit.SOURCE_VECTOR);
            metadata.put("distance", match.distance());
            metadata.put("path", chunk.get().path());
            metadata.put("chunkIndex", chunk.get().chunkIndex());
            hits.add(new SearchHit(match.chunkId(), match.documentId(), chunk.get().content(), similarity, metadata));
        }
        hits.sort(SearchHitOrdering.BY_SCORE);
        return hits;
    }

    static double similarityOf(double distance) {
        return Math.max(0.0, Math.min(1.0, 1.0 - distance));
    }
}
