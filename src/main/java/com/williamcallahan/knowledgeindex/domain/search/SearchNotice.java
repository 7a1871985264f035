package com.williamcallahan.knowledgeindex.domain.search;

/**
 * Non-fatal notice about a retrieval branch that failed during a hybrid query.
 *
 * @param summary concise summary
 * @param details diagnostic details
 */
public record SearchNotice(String summary, String details) {
    public SearchNotice {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary cannot be null or blank");
        }
        details = details == null ? "" : details;
    }
}
