package com.williamcallahan.knowledgeindex.service.search;

/**
 * Asks a model how relevant a passage is to a query.
 */
public interface RelevanceScorer {

    /**
     * Returns the model's raw reply, expected to contain a relevance rating from 0 to 10.
     *
     * @throws RerankingFailureException when the model could not be called
     */
    String score(String query, String passage);
}
