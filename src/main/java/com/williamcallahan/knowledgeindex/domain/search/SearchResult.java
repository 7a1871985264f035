package com.williamcallahan.knowledgeindex.domain.search;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Ranked hits of a query with its reporting data.
 *
 * @param hits hits sorted by score, highest first
 * @param totalCandidates unique candidates after fusion and before truncation
 * @param duration wall-clock time of the query
 * @param notices non-fatal retrieval notices
 */
public record SearchResult(List<SearchHit> hits, int totalCandidates, Duration duration, List<SearchNotice> notices) {

    public SearchResult {
        Objects.requireNonNull(duration, "duration");
        hits = hits == null ? List.of() : List.copyOf(hits);
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    public static SearchResult empty(Duration duration) {
        return new SearchResult(List.of(), 0, duration, List.of());
    }
}
