package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.config.SearchSettings;
import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import java.util.List;

/**
 * Fuses or rescores candidate hits into one ranked list.
 */
public interface SearchReranker {

    /**
     * Name used for configuration lookup, e.g. {@code RRF}.
     */
    String name();

    /**
     * Ranks the candidates, best first. Candidates may contain the same chunk more than once, once per source.
     *
     * @param query original query text
     * @param candidates hits from one or more retrieval sources
     * @param settings search settings captured when the query started
     * @return one hit per chunk with scores in [0, 1]
     */
    List<SearchHit> rerank(String query, List<SearchHit> candidates, SearchSettings settings);

    /**
     * Whether the reranker only fuses rank lists from several sources. Single-source searches skip such a
     * reranker since fusing one list would just replace its scores with rank positions.
     */
    default boolean fusesRankLists() {
        return false;
    }
}
