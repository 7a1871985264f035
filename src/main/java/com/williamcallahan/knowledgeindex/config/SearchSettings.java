package com.williamcallahan.knowledgeindex.config;

import com.williamcallahan.knowledgeindex.domain.search.SearchMode;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration captured when a query starts.
 *
 * @param mode default retrieval mode
 * @param topK default number of hits returned
 * @param minScore default minimum fused score
 * @param reranker default reranker name
 * @param rrfK reciprocal rank fusion k parameter
 * @param overFetchFactor multiplier applied to topK for per-branch candidate retrieval
 * @param branchTimeout time allowed for each retrieval branch
 * @param failOnPartialSearchError whether a failed branch fails the whole hybrid query
 */
public record SearchSettings(
        SearchMode mode,
        int topK,
        double minScore,
        String reranker,
        int rrfK,
        int overFetchFactor,
        Duration branchTimeout,
        boolean failOnPartialSearchError) {

    public SearchSettings {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(reranker, "reranker");
        Objects.requireNonNull(branchTimeout, "branchTimeout");
        overFetchFactor = Math.max(1, overFetchFactor);
        rrfK = Math.max(1, rrfK);
    }

    public static SearchSettings from(AppProperties appProperties) {
        AppProperties.Search search = appProperties.getSearch();
        return new SearchSettings(
                search.getMode(),
                search.getTopK(),
                search.getMinScore(),
                search.getReranker(),
                search.getRrfK(),
                search.getOverFetchFactor(),
                search.getBranchTimeout(),
                search.isFailOnPartialSearchError());
    }
}
