package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.domain.search.SearchMode;
import com.williamcallahan.knowledgeindex.domain.search.SearchRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for the search endpoint. Omitted options use the configured defaults.
 *
 * @param query query text
 * @param scopeId scope to search
 * @param pathPrefix optional path prefix filter
 * @param topK maximum hits
 * @param minScore minimum final score
 * @param mode SEMANTIC, KEYWORD or HYBRID
 * @param reranker reranker name, for example RRF or CrossEncoder
 */
public record SearchQueryRequest(
        @NotNull(message = "query is required") String query,
        @NotBlank(message = "scopeId is required") String scopeId,
        String pathPrefix,
        @Min(value = 1, message = "topK must be at least 1") @Max(value = 1000, message = "topK cannot exceed 1000")
                Integer topK,
        Double minScore,
        SearchMode mode,
        String reranker) {

    public SearchRequest toSearchRequest() {
        return new SearchRequest(query, scopeId, pathPrefix, topK, minScore, mode, reranker);
    }
}
