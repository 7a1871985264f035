package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.config.SearchSettings;
import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import com.williamcallahan.knowledgeindex.domain.search.SearchMode;
import com.williamcallahan.knowledgeindex.domain.search.SearchNotice;
import com.williamcallahan.knowledgeindex.domain.search.SearchRequest;
import com.williamcallahan.knowledgeindex.domain.search.SearchResult;
import com.williamcallahan.knowledgeindex.store.SearchFilter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Executes semantic, keyword or hybrid retrieval and returns one ranked, thresholded list.
 *
 * <p>In hybrid mode the vector and keyword branches run concurrently on the search executor, each against
 * its own index session. Every hit is tagged with its source and both lists are concatenated, duplicates
 * included, before the configured reranker fuses them. The minimum score is applied after fusion so that
 * fusion sees complete rank lists. Semantic and keyword searches keep their branch scores unless a
 * rescoring reranker is configured. A failed branch becomes a {@link SearchNotice}, or a
 * {@link HybridSearchPartialFailureException} when strict mode is on.</p>
 */
@Service
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    private static final int MAX_FAILURE_DETAIL_LENGTH = 240;

    private final VectorSearchService vectorSearch;
    private final KeywordSearchService keywordSearch;
    private final SearchRerankerRegistry rerankers;
    private final AppProperties appProperties;
    private final Executor searchExecutor;

    /**
     * Wires retrieval branches, rerankers and the executor running hybrid branches.
     *
     * @param vectorSearch dense retrieval branch
     * @param keywordSearch lexical retrieval branch
     * @param rerankers reranker lookup
     * @param appProperties source of per-query settings snapshots
     * @param searchExecutor executor for concurrent branches
     */
    public HybridSearchService(
            VectorSearchService vectorSearch,
            KeywordSearchService keywordSearch,
            SearchRerankerRegistry rerankers,
            AppProperties appProperties,
            @Qualifier("searchExecutor") Executor searchExecutor) {
        this.vectorSearch = Objects.requireNonNull(vectorSearch, "vectorSearch");
        this.keywordSearch = Objects.requireNonNull(keywordSearch, "keywordSearch");
        this.rerankers = Objects.requireNonNull(rerankers, "rerankers");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
    }

    /**
     * Runs a query with settings captured at the start of the call.
     *
     * @param request query and overrides
     * @return ranked hits, candidate count, duration and notices
     * @throws HybridSearchPartialFailureException when a hybrid branch fails in strict mode
     */
    public SearchResult search(SearchRequest request) {
        Objects.requireNonNull(request, "request");
        long startNanos = System.nanoTime();
        if (request.query().isBlank()) {
            return SearchResult.empty(elapsedSince(startNanos));
        }
        SearchSettings settings = SearchSettings.from(appProperties);
        SearchMode mode = request.mode() != null ? request.mode() : settings.mode();
        int topK = request.topK() != null ? request.topK() : settings.topK();
        double minScore = request.minScore() != null ? request.minScore() : settings.minScore();
        int candidateLimit = Math.max(topK, topK * settings.overFetchFactor());
        SearchFilter filter = new SearchFilter(request.scopeId(), request.pathPrefix());

        List<SearchNotice> notices = new ArrayList<>();
        List<SearchHit> ranked;
        switch (mode) {
            case SEMANTIC -> ranked = rescoreSingleSource(
                    request, settings, vectorSearch.search(request.query(), filter, candidateLimit, minScore), notices);
            case KEYWORD -> ranked = rescoreSingleSource(
                    request, settings, keywordSearch.search(request.query(), filter, candidateLimit, minScore), notices);
            default -> ranked = hybrid(request, settings, filter, candidateLimit, notices);
        }

        int totalCandidates = countUniqueChunks(ranked);
        List<SearchHit> hits = ranked.stream()
                .filter(hit -> hit.score() >= minScore)
                .sorted(SearchHitOrdering.BY_SCORE)
                .limit(topK)
                .toList();
        Duration duration = elapsedSince(startNanos);
        log.debug(
                "[SEARCH] mode={} hits={} candidates={} notices={} in {} ms",
                mode,
                hits.size(),
                totalCandidates,
                notices.size(),
                duration.toMillis());
        return new SearchResult(hits, totalCandidates, duration, notices);
    }

    private List<SearchHit> hybrid(
            SearchRequest request,
            SearchSettings settings,
            SearchFilter filter,
            int candidateLimit,
            List<SearchNotice> notices) {
        String query = request.query();
        CompletableFuture<List<SearchHit>> vectorBranch = CompletableFuture.supplyAsync(
                () -> vectorSearch.search(query, filter, candidateLimit, 0.0), searchExecutor);
        CompletableFuture<List<SearchHit>> keywordBranch = CompletableFuture.supplyAsync(
                () -> keywordSearch.search(query, filter, candidateLimit, 0.0), searchExecutor);

        List<HybridSearchPartialFailureException.BranchFailure> failures = new ArrayList<>();
        List<SearchHit> candidates = new ArrayList<>();
        collectBranch(SearchHit.SOURCE_VECTOR, vectorBranch, settings.branchTimeout(), candidates, failures);
        collectBranch(SearchHit.SOURCE_KEYWORD, keywordBranch, settings.branchTimeout(), candidates, failures);

        if (!failures.isEmpty() && settings.failOnPartialSearchError()) {
            throw new HybridSearchPartialFailureException(
                    "Hybrid retrieval failed for " + failures.size() + " branch(es)", failures);
        }
        for (HybridSearchPartialFailureException.BranchFailure failure : failures) {
            notices.add(toNotice(failure));
        }

        SearchReranker reranker = resolveReranker(request, settings);
        try {
            return reranker.rerank(query, candidates, settings);
        } catch (RerankingFailureException rerankFailure) {
            log.warn("[SEARCH] Reranker {} failed, falling back to {}", reranker.name(), rerankers.fallback().name());
            notices.add(new SearchNotice(
                    "Reranking failed, fused ranking used", sanitizeFailureDetails(rerankFailure.getMessage())));
            return rerankers.fallback().rerank(query, candidates, settings);
        }
    }

    /**
     * Applies a rescoring reranker such as the cross-encoder to a single-branch result. A failed rescoring
     * keeps the branch ranking.
     */
    private List<SearchHit> rescoreSingleSource(
            SearchRequest request, SearchSettings settings, List<SearchHit> hits, List<SearchNotice> notices) {
        SearchReranker reranker = resolveReranker(request, settings);
        if (hits.isEmpty() || reranker.fusesRankLists()) {
            return hits;
        }
        try {
            return reranker.rerank(request.query(), hits, settings);
        } catch (RerankingFailureException rerankFailure) {
            log.warn("[SEARCH] Reranker {} failed, keeping retrieval order", reranker.name());
            notices.add(new SearchNotice(
                    "Reranking failed, retrieval ranking used", sanitizeFailureDetails(rerankFailure.getMessage())));
            return hits;
        }
    }

    private SearchReranker resolveReranker(SearchRequest request, SearchSettings settings) {
        String rerankerName = request.reranker() != null ? request.reranker() : settings.reranker();
        return rerankers.resolve(rerankerName);
    }

    private void collectBranch(
            String branch,
            CompletableFuture<List<SearchHit>> future,
            Duration timeout,
            List<SearchHit> candidates,
            List<HybridSearchPartialFailureException.BranchFailure> failures) {
        try {
            for (SearchHit hit : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                candidates.add(hit.withSource(branch));
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[SEARCH] {} branch interrupted", branch);
            failures.add(new HybridSearchPartialFailureException.BranchFailure(
                    branch, "Interrupted", "Search branch was interrupted"));
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause();
            String exceptionType = cause == null
                    ? executionException.getClass().getSimpleName()
                    : cause.getClass().getSimpleName();
            String failureMessage = cause == null ? executionException.getMessage() : cause.getMessage();
            log.warn("[SEARCH] {} branch failed (exceptionType={})", branch, exceptionType);
            failures.add(new HybridSearchPartialFailureException.BranchFailure(
                    branch, exceptionType, sanitizeFailureDetails(failureMessage)));
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            log.warn("[SEARCH] {} branch timed out", branch);
            failures.add(new HybridSearchPartialFailureException.BranchFailure(
                    branch, "Timeout", "Search branch exceeded timeout " + timeout.toMillis() + "ms"));
        }
    }

    private static int countUniqueChunks(List<SearchHit> hits) {
        Set<String> chunkIds = new HashSet<>();
        for (SearchHit hit : hits) {
            chunkIds.add(hit.chunkId());
        }
        return chunkIds.size();
    }

    private static SearchNotice toNotice(HybridSearchPartialFailureException.BranchFailure failure) {
        String summary = "Partial retrieval failure in " + failure.branch() + " search";
        String details = failure.failureType() + ": " + failure.failureDetails();
        return new SearchNotice(summary, details);
    }

    private static String sanitizeFailureDetails(String failureDetails) {
        if (failureDetails == null || failureDetails.isBlank()) {
            return "";
        }
        String flattenedFailure = failureDetails.replace('\n', ' ').replace('\r', ' ').trim();
        if (flattenedFailure.length() <= MAX_FAILURE_DETAIL_LENGTH) {
            return flattenedFailure;
        }
        return flattenedFailure.substring(0, MAX_FAILURE_DETAIL_LENGTH) + "...";
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
