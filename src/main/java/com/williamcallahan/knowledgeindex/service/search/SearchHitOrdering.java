package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import java.util.Comparator;

final class SearchHitOrdering {

    /** Score descending, then chunk id ascending. */
    static final Comparator<SearchHit> BY_SCORE =
            Comparator.comparingDouble(SearchHit::score).reversed().thenComparing(SearchHit::chunkId);

    private SearchHitOrdering() {}
}
