package com.williamcallahan.knowledgeindex.domain.search;

import java.util.Objects;

/**
 * A search query with optional per-query overrides.
 *
 * <p>Null overrides fall back to the configured search settings captured when the query starts.</p>
 *
 * @param query query text
 * @param scopeId scope to search within
 * @param pathPrefix optional logical path prefix filter
 * @param topK maximum hits returned, null for the configured default
 * @param minScore minimum fused score, null for the configured default
 * @param mode retrieval mode, null for the configured default
 * @param reranker reranker name, null for the configured default
 */
public record SearchRequest(
        String query,
        String scopeId,
        String pathPrefix,
        Integer topK,
        Double minScore,
        SearchMode mode,
        String reranker) {

    public SearchRequest {
        Objects.requireNonNull(query, "query");
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId is required");
        }
        pathPrefix = pathPrefix == null ? "" : pathPrefix;
        if (topK != null && topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
    }

    public static SearchRequest of(String query, String scopeId) {
        return new SearchRequest(query, scopeId, "", null, null, null, null);
    }

    public SearchRequest withMode(SearchMode newMode) {
        return new SearchRequest(query, scopeId, pathPrefix, topK, minScore, newMode, reranker);
    }

    public SearchRequest withTopK(int newTopK) {
        return new SearchRequest(query, scopeId, pathPrefix, newTopK, minScore, mode, reranker);
    }

    public SearchRequest withMinScore(double newMinScore) {
        return new SearchRequest(query, scopeId, pathPrefix, topK, newMinScore, mode, reranker);
    }

    public SearchRequest withPathPrefix(String newPathPrefix) {
        return new SearchRequest(query, scopeId, newPathPrefix, topK, minScore, mode, reranker);
    }

    public SearchRequest withReranker(String newReranker) {
        return new SearchRequest(query, scopeId, pathPrefix, topK, minScore, mode, newReranker);
    }
}
