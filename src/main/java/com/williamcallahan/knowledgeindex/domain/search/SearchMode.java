package com.williamcallahan.knowledgeindex.domain.search;

/**
 * Retrieval mode of a query.
 */
public enum SearchMode {
    SEMANTIC,
    KEYWORD,
    HYBRID
}
