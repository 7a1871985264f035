package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import com.williamcallahan.knowledgeindex.store.KeywordIndex;
import com.williamcallahan.knowledgeindex.store.KeywordMatch;
import com.williamcallahan.knowledgeindex.store.SearchFilter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Lexical retrieval with min-max normalized scores.
 */
@Service
public class KeywordSearchService {

    private final KeywordIndex keywordIndex;

    public KeywordSearchService(KeywordIndex keywordIndex) {
        this.keywordIndex = Objects.requireNonNull(keywordIndex, "keywordIndex");
    }

    /**
     * Returns hits normalized into [0, 1] within this result set, best first. When every raw score is equal
     * each hit scores 1.0. The raw engine score is kept under {@code rawScore}.
     */
    public List<SearchHit> search(String query, SearchFilter filter, int candidateLimit, double minScore) {
        List<KeywordMatch> matches = keywordIndex.search(query, candidateLimit, filter);
        if (matches.isEmpty()) {
            return List.of();
        }
        double minRaw = Double.POSITIVE_INFINITY;
        double maxRaw = Double.NEGATIVE_INFINITY;
        for (KeywordMatch match : matches) {
            minRaw = Math.min(minRaw, match.rawScore());
            maxRaw = Math.max(maxRaw, match.rawScore());
        }
        double range = maxRaw - minRaw;

        List<SearchHit> hits = new ArrayList<>(matches.size());
        for (KeywordMatch match : matches) {
            double normalized = range <= 0.0 ? 1.0 : (match.rawScore() - minRaw) / range;
            if (normalized < minScore) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(SearchHit.SOURCE_KEY, SearchHit.SOURCE_KEYWORD);
            metadata.put("rawScore", match.rawScore());
            hits.add(new SearchHit(match.chunkId(), match.documentId(), match.content(), normalized, metadata));
        }
        hits.sort(SearchHitOrdering.BY_SCORE);
        return hits;
    }
}
