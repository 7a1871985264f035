package com.williamcallahan.knowledgeindex.service.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import com.williamcallahan.knowledgeindex.store.KeywordIndex;
import com.williamcallahan.knowledgeindex.store.KeywordMatch;
import com.williamcallahan.knowledgeindex.store.SearchFilter;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Score normalization of the individual retrieval branches.
 */
class SearchBranchScoringTest {

    private static final SearchFilter FILTER = new SearchFilter("team", "");

    @Test
    void vectorDistanceMapsToClampedSimilarity() {
        assertEquals(1.0, VectorSearchService.similarityOf(0.0), 1e-12);
        assertEquals(0.75, VectorSearchService.similarityOf(0.25), 1e-12);
        assertEquals(0.0, VectorSearchService.similarityOf(1.7), 1e-12);
        assertEquals(1.0, VectorSearchService.similarityOf(-0.2), 1e-12);
    }

    @Test
    void keywordScoresAreMinMaxNormalized() {
        KeywordIndex index = mock(KeywordIndex.class);
        when(index.search(anyString(), anyInt(), any(SearchFilter.class))).thenReturn(List.of(
                new KeywordMatch("c1", "d1", "alpha", 8.0),
                new KeywordMatch("c2", "d2", "beta", 4.0),
                new KeywordMatch("c3", "d3", "gamma", 2.0)));

        List<SearchHit> hits = new KeywordSearchService(index).search("q", FILTER, 10, 0.0);

        assertEquals(List.of("c1", "c2", "c3"), hits.stream().map(SearchHit::chunkId).toList());
        assertEquals(1.0, hits.get(0).score(), 1e-12);
        assertEquals(2.0 / 6.0, hits.get(1).score(), 1e-12);
        assertEquals(0.0, hits.get(2).score(), 1e-12);
        assertEquals(8.0, (Double) hits.get(0).metadata().get("rawScore"), 1e-12);
        assertTrue(hits.stream().allMatch(hit -> SearchHit.SOURCE_KEYWORD.equals(hit.source())));
    }

    @Test
    void equalKeywordScoresAllNormalizeToOne() {
        KeywordIndex index = mock(KeywordIndex.class);
        when(index.search(anyString(), anyInt(), any(SearchFilter.class))).thenReturn(List.of(
                new KeywordMatch("c1", "d1", "alpha", 3.0), new KeywordMatch("c2", "d2", "beta", 3.0)));

        List<SearchHit> hits = new KeywordSearchService(index).search("q", FILTER, 10, 0.5);

        assertEquals(2, hits.size());
        assertTrue(hits.stream().allMatch(hit -> hit.score() == 1.0));
    }

    @Test
    void keywordMinScoreDropsWeakMatches() {
        KeywordIndex index = mock(KeywordIndex.class);
        when(index.search(anyString(), anyInt(), any(SearchFilter.class))).thenReturn(List.of(
                new KeywordMatch("c1", "d1", "alpha", 10.0), new KeywordMatch("c2", "d2", "beta", 1.0)));

        List<SearchHit> hits = new KeywordSearchService(index).search("q", FILTER, 10, 0.5);

        assertEquals(List.of("c1"), hits.stream().map(SearchHit::chunkId).toList());
    }
}
