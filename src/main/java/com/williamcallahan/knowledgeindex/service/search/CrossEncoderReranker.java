package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.config.SearchSettings;
import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rescores each candidate by asking a {@link RelevanceScorer} to rate it against the query.
 *
 * <p>Duplicate chunks are merged first, keeping the best score. Each pair is scored on its own: a failed
 * call leaves that hit at its previous score, an unparseable reply counts as a neutral 5. Ratings are
 * clamped to 0-10 and divided by 10.</p>
 */
public class CrossEncoderReranker implements SearchReranker {
    private static final Logger log = LoggerFactory.getLogger(CrossEncoderReranker.class);

    public static final String NAME = "CrossEncoder";

    static final double NEUTRAL_SCORE = 5.0;
    private static final double MAX_SCORE = 10.0;
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private final RelevanceScorer relevanceScorer;

    public CrossEncoderReranker(RelevanceScorer relevanceScorer) {
        this.relevanceScorer = Objects.requireNonNull(relevanceScorer, "relevanceScorer");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SearchHit> rerank(String query, List<SearchHit> candidates, SearchSettings settings) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Map<String, SearchHit> bestByChunk = new LinkedHashMap<>();
        for (SearchHit candidate : candidates) {
            bestByChunk.merge(candidate.chunkId(), candidate, (kept, other) -> other.score() > kept.score() ? other : kept);
        }

        List<SearchHit> rescored = new ArrayList<>(bestByChunk.size());
        int failures = 0;
        for (SearchHit hit : bestByChunk.values()) {
            try {
                double rating = clamp(parseRating(relevanceScorer.score(query, hit.content())));
                rescored.add(hit.rescored(rating / MAX_SCORE, Map.of("crossEncoderScore", rating, "reranker", NAME)));
            } catch (RuntimeException scoringFailure) {
                failures++;
                log.debug("[SEARCH] Relevance scoring failed for chunk {}: {}", hit.chunkId(), scoringFailure.getMessage());
                rescored.add(hit.rescored(hit.score(), Map.of("reranker", NAME)));
            }
        }
        if (failures > 0) {
            log.warn("[SEARCH] Relevance scoring failed for {} of {} candidates", failures, rescored.size());
        }
        rescored.sort(SearchHitOrdering.BY_SCORE);
        return rescored;
    }

    static double parseRating(String reply) {
        if (reply == null || reply.isBlank()) {
            return NEUTRAL_SCORE;
        }
        Matcher matcher = NUMBER.matcher(reply);
        if (!matcher.find()) {
            return NEUTRAL_SCORE;
        }
        try {
            return Double.parseDouble(matcher.group());
        } catch (NumberFormatException unparseable) {
            return NEUTRAL_SCORE;
        }
    }

    private static double clamp(double rating) {
        return Math.max(0.0, Math.min(MAX_SCORE, rating));
    }
}
