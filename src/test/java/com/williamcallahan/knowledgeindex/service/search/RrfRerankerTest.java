package com.williamcallahan.knowledgeindex.service.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.config.SearchSettings;
import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import com.williamcallahan.knowledgeindex.domain.search.SearchMode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RrfRerankerTest {

    private static final SearchSettings SETTINGS =
            new SearchSettings(SearchMode.HYBRID, 10, 0.0, RrfReranker.NAME, 60, 3, Duration.ofSeconds(1), false);

    private final RrfReranker reranker = new RrfReranker();

    @Test
    void chunkFoundByBothSourcesOutranksSingleSourceLeaders() {
        List<SearchHit> candidates = List.of(
                hit("vector-only", 0.95, SearchHit.SOURCE_VECTOR),
                hit("shared", 0.80, SearchHit.SOURCE_VECTOR),
                hit("keyword-only", 0.99, SearchHit.SOURCE_KEYWORD),
                hit("shared", 0.70, SearchHit.SOURCE_KEYWORD));

        List<SearchHit> ranked = reranker.rerank("q", candidates, SETTINGS);

        assertEquals(3, ranked.size());
        assertEquals("shared", ranked.get(0).chunkId());
        assertEquals(1.0, ranked.get(0).score(), 1e-9);
        assertEquals(0.0, ranked.get(2).score(), 1e-9);
        Map<String, Object> metadata = ranked.get(0).metadata();
        assertEquals("keyword,vector", metadata.get("sources"));
        assertEquals(1.0 / 62, (Double) metadata.get("vectorContribution"), 1e-12);
        assertEquals(1.0 / 62, (Double) metadata.get("keywordContribution"), 1e-12);
        assertEquals(2.0 / 62, (Double) metadata.get("rrfScore"), 1e-12);
    }

    @Test
    void singleCandidateScoresOne() {
        List<SearchHit> ranked = reranker.rerank("q", List.of(hit("only", 0.2, SearchHit.SOURCE_KEYWORD)), SETTINGS);

        assertEquals(1, ranked.size());
        assertEquals(1.0, ranked.get(0).score(), 1e-9);
        assertEquals(0.0, (Double) ranked.get(0).metadata().get("vectorContribution"), 1e-12);
    }

    @Test
    void tiesAreBrokenByChunkId() {
        List<SearchHit> ranked = reranker.rerank(
                "q",
                List.of(hit("b", 0.9, SearchHit.SOURCE_VECTOR), hit("a", 0.9, SearchHit.SOURCE_KEYWORD)),
                SETTINGS);

        assertEquals(List.of("a", "b"), ranked.stream().map(SearchHit::chunkId).toList());
        assertTrue(ranked.stream().allMatch(hit -> hit.score() == 1.0));
    }

    @Test
    void emptyCandidatesGiveEmptyRanking() {
        assertTrue(reranker.rerank("q", List.of(), SETTINGS).isEmpty());
    }

    private static SearchHit hit(String chunkId, double score, String source) {
        return new SearchHit(chunkId, "doc-" + chunkId, "content " + chunkId, score, Map.of(SearchHit.SOURCE_KEY, source));
    }
}
